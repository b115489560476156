package io.agentrelay.model;

public enum ConversationStatus {
    ACTIVE,
    CLOSED
}
