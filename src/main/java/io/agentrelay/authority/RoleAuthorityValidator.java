package io.agentrelay.authority;

import io.agentrelay.model.Envelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Table-driven authority check. An allow directive matching the sender, the
 * task type and every target permits the envelope outright. Otherwise the
 * sender must hold the task type (or the type must be open to all), and no
 * target may hit a deny directive that an allow directive does not cover.
 */
public final class RoleAuthorityValidator implements AuthorityValidator {
    private final AuthorityPolicy policy;

    public RoleAuthorityValidator() {
        this(AuthorityPolicy.defaults());
    }

    public RoleAuthorityValidator(AuthorityPolicy policy) {
        this.policy = policy == null ? AuthorityPolicy.defaults() : policy;
    }

    public AuthorityPolicy policy() {
        return policy;
    }

    @Override
    public ValidationOutcome validate(Envelope envelope) {
        List<String> violations = new ArrayList<>();
        String sender = envelope.sender();
        String taskType = envelope.taskType();
        List<String> targets = directedTargets(envelope);

        if (taskType != null && !allTargetsExplicitlyAllowed(sender, targets, taskType)) {
            List<String> granted = policy.roles().getOrDefault(sender, List.of());
            if (!granted.contains(taskType) && !policy.openTaskTypes().contains(taskType)) {
                violations.add("Agent " + sender + " lacks authority for task type " + taskType);
            }
        }

        for (String target : targets) {
            if (explicitlyAllowed(sender, target, taskType)) {
                continue;
            }
            for (AuthorityPolicy.Directive directive : policy.deny()) {
                if (directive.matches(sender, target, taskType)) {
                    violations.add(directive.violation() == null
                            ? "Directive from " + sender + " to " + target + " is not permitted"
                            : directive.violation());
                }
            }
        }
        return violations.isEmpty() ? ValidationOutcome.allow() : ValidationOutcome.deny(violations);
    }

    // An allow directive covering every target stands in for the role grant.
    private boolean allTargetsExplicitlyAllowed(String sender, List<String> targets, String taskType) {
        if (targets.isEmpty()) {
            return false;
        }
        for (String target : targets) {
            if (!explicitlyAllowed(sender, target, taskType)) {
                return false;
            }
        }
        return true;
    }

    private boolean explicitlyAllowed(String sender, String target, String taskType) {
        for (AuthorityPolicy.Directive directive : policy.allow()) {
            if (directive.matches(sender, target, taskType)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> directedTargets(Envelope envelope) {
        if (envelope.kind().directed()) {
            return envelope.target() == null ? List.of() : List.of(envelope.target());
        }
        if (envelope.broadcastTargets() == null || envelope.broadcastTargets().allRegistered()) {
            return List.of();
        }
        return envelope.broadcastTargets().agents();
    }
}
