package io.agentrelay.authority;

import java.util.List;

public record ValidationOutcome(boolean allowed, List<String> violations) {
    public ValidationOutcome {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ValidationOutcome allow() {
        return new ValidationOutcome(true, List.of());
    }

    public static ValidationOutcome deny(List<String> violations) {
        return new ValidationOutcome(false, violations);
    }
}
