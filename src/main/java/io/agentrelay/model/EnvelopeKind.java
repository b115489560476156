package io.agentrelay.model;

import java.util.Locale;

public enum EnvelopeKind {
    TASK_REQUEST,
    TASK_RESPONSE,
    AGENT_MESSAGE,
    BROADCAST;

    public boolean directed() {
        return this != BROADCAST;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EnvelopeKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Envelope kind is required");
        }
        String normalized = raw.trim().replace('-', '_');
        for (EnvelopeKind value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown envelope kind: " + raw);
    }
}
