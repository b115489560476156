package io.agentrelay.conversation;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Fixed table of conversation kinds that always run under oversight.
 */
public final class OversightPolicy {
    public static final Set<String> DEFAULT_KINDS = Set.of(
            "collective_decision",
            "constitutional_review",
            "crisis_management"
    );

    private final Set<String> kinds;

    private OversightPolicy(Set<String> kinds) {
        this.kinds = Set.copyOf(kinds);
    }

    public static OversightPolicy defaults() {
        return new OversightPolicy(DEFAULT_KINDS);
    }

    public static OversightPolicy of(Collection<String> kinds) {
        Set<String> normalized = new LinkedHashSet<>();
        if (kinds != null) {
            for (String kind : kinds) {
                if (kind != null && !kind.isBlank()) {
                    normalized.add(normalize(kind));
                }
            }
        }
        return new OversightPolicy(normalized);
    }

    public boolean requiresOversight(String kind) {
        return kind != null && kinds.contains(normalize(kind));
    }

    public Set<String> kinds() {
        return kinds;
    }

    private static String normalize(String kind) {
        return kind.trim().toLowerCase(Locale.ROOT);
    }
}
