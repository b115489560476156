package io.agentrelay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one send. {@code perTarget} keeps resolution order so callers can
 * tell a partial broadcast from a total miss.
 */
public record DeliveryResult(
        String envelopeId,
        EnvelopeKind kind,
        boolean success,
        String reason,
        List<String> violations,
        Map<String, Boolean> perTarget,
        Map<String, String> failures,
        int successfulCount,
        int totalTargets
) {
    public static final String DELIVERED = "delivered";
    public static final String PARTIAL = "partial";
    public static final String UNDELIVERED = "undelivered";
    public static final String NO_TARGETS = "no_targets";
    public static final String AUTHORITY_DENIED = "authority_denied";

    public DeliveryResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        perTarget = perTarget == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(perTarget));
        failures = failures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public static DeliveryResult denied(String envelopeId, EnvelopeKind kind, List<String> violations) {
        return new DeliveryResult(envelopeId, kind, false, AUTHORITY_DENIED, violations, Map.of(), Map.of(), 0, 0);
    }

    public static DeliveryResult routed(
            String envelopeId,
            EnvelopeKind kind,
            Map<String, Boolean> perTarget,
            Map<String, String> failures
    ) {
        int total = perTarget.size();
        int ok = (int) perTarget.values().stream().filter(Boolean::booleanValue).count();
        String reason;
        if (total == 0) {
            reason = NO_TARGETS;
        } else if (ok == total) {
            reason = DELIVERED;
        } else if (ok == 0) {
            reason = UNDELIVERED;
        } else {
            reason = PARTIAL;
        }
        return new DeliveryResult(envelopeId, kind, total > 0 && ok == total, reason, List.of(), perTarget, failures, ok, total);
    }

    public boolean denied() {
        return AUTHORITY_DENIED.equals(reason);
    }

    public double deliveryRate() {
        if (totalTargets == 0) {
            return 0.0;
        }
        return (double) successfulCount / totalTargets;
    }
}
