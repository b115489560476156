package io.agentrelay.observability;

import io.agentrelay.model.DeliveryResult;
import io.agentrelay.model.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record AuditEvent(
        String action,
        String actor,
        String resource,
        String result,
        String kind,
        List<String> targets,
        Map<String, String> outcomes,
        String validation,
        List<String> violations,
        String conversationId,
        long timestampMs,
        Map<String, Object> details
) {
    public static final String VALIDATION_NOT_REQUIRED = "not_required";
    public static final String VALIDATION_ALLOWED = "allowed";
    public static final String VALIDATION_DENIED = "denied";

    public AuditEvent {
        targets = targets == null ? List.of() : List.copyOf(targets);
        outcomes = outcomes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        violations = violations == null ? List.of() : List.copyOf(violations);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static AuditEvent routed(Envelope envelope, DeliveryResult result, String validation, long timestampMs,
                                    Map<String, Object> details) {
        Map<String, String> outcomes = new LinkedHashMap<>();
        result.perTarget().forEach((agent, ok) ->
                outcomes.put(agent, ok ? "delivered" : result.failures().getOrDefault(agent, "failed")));
        return new AuditEvent(
                "envelope.route",
                envelope.sender(),
                envelope.id(),
                result.reason(),
                envelope.kind().wireName(),
                new ArrayList<>(result.perTarget().keySet()),
                outcomes,
                validation,
                List.of(),
                envelope.conversationId(),
                timestampMs,
                details
        );
    }

    public static AuditEvent denied(Envelope envelope, List<String> violations, long timestampMs) {
        List<String> targets = envelope.target() != null
                ? List.of(envelope.target())
                : envelope.broadcastTargets() == null ? List.of() : envelope.broadcastTargets().agents();
        return new AuditEvent(
                "envelope.denied",
                envelope.sender(),
                envelope.id(),
                DeliveryResult.AUTHORITY_DENIED,
                envelope.kind().wireName(),
                targets,
                Map.of(),
                VALIDATION_DENIED,
                violations,
                envelope.conversationId(),
                timestampMs,
                Map.of()
        );
    }

    public static AuditEvent of(String action, String actor, String resource, String result, long timestampMs,
                                Map<String, Object> details) {
        return new AuditEvent(action, actor, resource, result, null, List.of(), Map.of(), null, List.of(), null,
                timestampMs, details);
    }
}
