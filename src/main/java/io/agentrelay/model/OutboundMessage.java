package io.agentrelay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draft of an envelope as handed to the broker. Identity and creation time are
 * assigned on admission.
 */
public record OutboundMessage(
        EnvelopeKind kind,
        String sender,
        String target,
        BroadcastTargets broadcastTargets,
        Priority priority,
        Map<String, Object> payload,
        boolean requiresAuthorityCheck,
        String conversationId,
        String requestId,
        Long expiresAtMs
) {
    public static final String TASK_TYPE = "task_type";
    public static final String SUBTYPE = "subtype";

    public OutboundMessage {
        priority = priority == null ? Priority.ROUTINE : priority;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static OutboundMessage taskRequest(String sender, String target, String taskType, Map<String, Object> parameters) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (parameters != null) {
            body.putAll(parameters);
        }
        if (taskType != null) {
            body.put(TASK_TYPE, taskType);
        }
        return new OutboundMessage(EnvelopeKind.TASK_REQUEST, sender, target, null, Priority.ROUTINE,
                body, false, null, null, null);
    }

    public static OutboundMessage taskResponse(String sender, String requester, String requestId, Map<String, Object> result) {
        return new OutboundMessage(EnvelopeKind.TASK_RESPONSE, sender, requester, null, Priority.ROUTINE,
                result, false, null, requestId, null);
    }

    public static OutboundMessage agentMessage(String sender, String target, Map<String, Object> body) {
        return new OutboundMessage(EnvelopeKind.AGENT_MESSAGE, sender, target, null, Priority.ROUTINE,
                body, false, null, null, null);
    }

    public static OutboundMessage broadcast(String sender, List<String> targets, Map<String, Object> body) {
        return new OutboundMessage(EnvelopeKind.BROADCAST, sender, null, BroadcastTargets.of(targets), Priority.ROUTINE,
                body, false, null, null, null);
    }

    public static OutboundMessage broadcastToAll(String sender, Map<String, Object> body) {
        return new OutboundMessage(EnvelopeKind.BROADCAST, sender, null, BroadcastTargets.allAgents(), Priority.ROUTINE,
                body, false, null, null, null);
    }

    public OutboundMessage withPriority(Priority value) {
        return new OutboundMessage(kind, sender, target, broadcastTargets, value, payload,
                requiresAuthorityCheck, conversationId, requestId, expiresAtMs);
    }

    public OutboundMessage withAuthorityCheck() {
        return new OutboundMessage(kind, sender, target, broadcastTargets, priority, payload,
                true, conversationId, requestId, expiresAtMs);
    }

    public OutboundMessage inConversation(String value) {
        return new OutboundMessage(kind, sender, target, broadcastTargets, priority, payload,
                requiresAuthorityCheck, value, requestId, expiresAtMs);
    }

    public OutboundMessage expiringAt(long epochMs) {
        return new OutboundMessage(kind, sender, target, broadcastTargets, priority, payload,
                requiresAuthorityCheck, conversationId, requestId, epochMs);
    }
}
