package io.agentrelay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Envelope(
        String id,
        EnvelopeKind kind,
        String sender,
        String target,
        BroadcastTargets broadcastTargets,
        Priority priority,
        Map<String, Object> payload,
        boolean requiresAuthorityCheck,
        String conversationId,
        String requestId,
        long createdAtMs,
        Long expiresAtMs
) {
    public Envelope {
        priority = priority == null ? Priority.ROUTINE : priority;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Envelope admit(String id, long createdAtMs, OutboundMessage draft) {
        return new Envelope(
                id,
                draft.kind(),
                draft.sender(),
                draft.target(),
                draft.broadcastTargets(),
                draft.priority(),
                draft.payload(),
                draft.requiresAuthorityCheck(),
                draft.conversationId(),
                draft.requestId(),
                createdAtMs,
                draft.expiresAtMs()
        );
    }

    public boolean isExpired(long nowMs) {
        return expiresAtMs != null && expiresAtMs <= nowMs;
    }

    public String taskType() {
        Object raw = payload.get(OutboundMessage.TASK_TYPE);
        return raw == null ? null : raw.toString();
    }

    public String subtype() {
        Object raw = payload.get(OutboundMessage.SUBTYPE);
        return raw == null ? null : raw.toString();
    }
}
