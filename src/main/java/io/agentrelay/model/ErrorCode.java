package io.agentrelay.model;

import java.util.Locale;

public enum ErrorCode {
    MALFORMED_ENVELOPE,
    AUTHORITY_DENIED,
    CAPACITY_EXCEEDED,
    NOT_FOUND,
    ALREADY_REGISTERED,
    INVALID_PARTICIPANTS,
    CONVERSATION_CLOSED,
    CONVERSATION_ACTIVE,
    BROKER_SHUT_DOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
