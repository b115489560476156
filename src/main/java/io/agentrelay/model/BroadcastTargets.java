package io.agentrelay.model;

import java.util.List;

/**
 * Target-set rule of a broadcast: either an explicit agent list or every agent
 * registered at routing time.
 */
public record BroadcastTargets(boolean allRegistered, List<String> agents) {
    public BroadcastTargets {
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    public static BroadcastTargets allAgents() {
        return new BroadcastTargets(true, List.of());
    }

    public static BroadcastTargets of(List<String> agents) {
        return new BroadcastTargets(false, agents);
    }
}
