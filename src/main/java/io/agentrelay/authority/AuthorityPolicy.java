package io.agentrelay.authority;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Role allow-lists plus separation-of-duties directives. Loaded from settings or
 * taken from {@link #defaults()}.
 */
public record AuthorityPolicy(
        Map<String, List<String>> roles,
        List<String> openTaskTypes,
        List<Directive> allow,
        List<Directive> deny
) {
    public static final String ANY = "*";

    public AuthorityPolicy {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (roles != null) {
            roles.forEach((agent, types) -> copy.put(agent, types == null ? List.of() : List.copyOf(types)));
        }
        roles = Map.copyOf(copy);
        openTaskTypes = openTaskTypes == null ? List.of() : List.copyOf(openTaskTypes);
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    public static AuthorityPolicy defaults() {
        Map<String, List<String>> roles = new LinkedHashMap<>();
        roles.put("planner_agent", List.of("planning", "policy", "legislation"));
        roles.put("executor_agent", List.of("execution", "implementation", "operation"));
        roles.put("evaluator_agent", List.of("validation", "compliance", "review"));
        roles.put("overwatch_agent", List.of("monitoring", "oversight", "emergency"));
        return new AuthorityPolicy(
                roles,
                List.of("communication", "status", "query"),
                List.of(
                        new Directive(List.of("planner_agent"), List.of("executor_agent"), List.of("execution"), null),
                        new Directive(List.of("executor_agent"), List.of("evaluator_agent"), List.of("validation"), null)
                ),
                List.of(
                        new Directive(
                                List.of("planner_agent", "executor_agent"),
                                List.of("evaluator_agent"),
                                List.of("override", "ignore"),
                                "Cannot override judicial decisions"
                        )
                )
        );
    }

    /**
     * Sender/target/task-type pattern. An empty list or {@code "*"} matches anything.
     */
    public record Directive(List<String> from, List<String> to, List<String> taskTypes, String violation) {
        public Directive {
            from = from == null ? List.of() : List.copyOf(from);
            to = to == null ? List.of() : List.copyOf(to);
            taskTypes = taskTypes == null ? List.of() : List.copyOf(taskTypes);
        }

        public boolean matches(String sender, String target, String taskType) {
            return matchesAny(from, sender) && matchesAny(to, target) && matchesAny(taskTypes, taskType);
        }

        private static boolean matchesAny(List<String> patterns, String value) {
            if (patterns.isEmpty() || patterns.contains(ANY)) {
                return true;
            }
            return value != null && patterns.contains(value);
        }
    }
}
