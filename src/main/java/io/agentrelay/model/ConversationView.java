package io.agentrelay.model;

import java.util.List;

/**
 * Point-in-time copy of a conversation; never shares state with the registry.
 */
public record ConversationView(
        String id,
        String kind,
        String topic,
        List<String> participants,
        String initiator,
        ConversationStatus status,
        boolean oversightRequired,
        long messageCount,
        long createdAtMs,
        long lastActivityAtMs,
        Long closedAtMs
) {
    public ConversationView {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public boolean active() {
        return status == ConversationStatus.ACTIVE;
    }
}
