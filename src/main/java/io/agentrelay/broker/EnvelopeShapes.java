package io.agentrelay.broker;

import io.agentrelay.model.BroadcastTargets;
import io.agentrelay.model.BrokerException;
import io.agentrelay.model.OutboundMessage;

/**
 * Structural checks on a draft before admission. The switch over
 * {@link io.agentrelay.model.EnvelopeKind} is a switch expression, so a new
 * kind does not compile until it has a rule here.
 */
final class EnvelopeShapes {
    private EnvelopeShapes() {
    }

    static void check(OutboundMessage draft) {
        if (draft == null) {
            throw BrokerException.malformed("envelope is required");
        }
        if (draft.kind() == null) {
            throw BrokerException.malformed("envelope kind is required");
        }
        if (isBlank(draft.sender())) {
            throw BrokerException.malformed("sender is required");
        }
        if (draft.expiresAtMs() != null && draft.expiresAtMs() <= 0L) {
            throw BrokerException.malformed("expires_at must be a positive epoch millisecond value");
        }
        String problem = switch (draft.kind()) {
            case TASK_REQUEST, AGENT_MESSAGE -> directedProblem(draft, false);
            case TASK_RESPONSE -> directedProblem(draft, true);
            case BROADCAST -> broadcastProblem(draft);
        };
        if (problem != null) {
            throw BrokerException.malformed(draft.kind().wireName() + ": " + problem);
        }
    }

    private static String directedProblem(OutboundMessage draft, boolean response) {
        if (isBlank(draft.target())) {
            return "target agent is required";
        }
        if (draft.broadcastTargets() != null) {
            return "a directed envelope cannot carry a broadcast target rule";
        }
        if (response && isBlank(draft.requestId())) {
            return "request id of the originating task request is required";
        }
        if (!response && draft.requestId() != null) {
            return "only task responses reference a request id";
        }
        return null;
    }

    private static String broadcastProblem(OutboundMessage draft) {
        if (draft.target() != null) {
            return "a broadcast cannot name a single target";
        }
        if (draft.requestId() != null) {
            return "only task responses reference a request id";
        }
        BroadcastTargets rule = draft.broadcastTargets();
        if (rule == null) {
            return "target rule is required";
        }
        if (rule.allRegistered()) {
            return rule.agents().isEmpty() ? null : "an all-agents rule cannot also list agents";
        }
        if (rule.agents().isEmpty()) {
            return "explicit target list is empty";
        }
        for (String agent : rule.agents()) {
            if (isBlank(agent)) {
                return "explicit target list contains an empty agent id";
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
