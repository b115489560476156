package io.agentrelay.config;

import io.agentrelay.authority.AuthorityPolicy;
import io.agentrelay.conversation.OversightPolicy;
import io.agentrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Broker settings resolved from {@code agentrelay-settings.json}. Every field of
 * the file is optional; missing or out-of-range values fall back to defaults.
 */
public record BrokerSettings(
        int defaultMailboxCapacity,
        List<AgentSpec> agents,
        List<String> oversightConversationKinds,
        String overseerAgent,
        long conversationIdleTimeoutMs,
        boolean authorityChecksEnabled,
        AuthorityPolicy authority,
        String auditSigningSecret,
        int maxTrackedTaskRequests
) {
    public static final int DEFAULT_MAILBOX_CAPACITY = 100;
    public static final int OVERSEER_MAILBOX_CAPACITY = 200;
    public static final String DEFAULT_OVERSEER = "overwatch_agent";
    public static final int DEFAULT_MAX_TRACKED_TASK_REQUESTS = 10_000;

    public BrokerSettings {
        agents = agents == null ? List.of() : List.copyOf(agents);
        oversightConversationKinds = oversightConversationKinds == null ? List.of() : List.copyOf(oversightConversationKinds);
        authority = authority == null ? AuthorityPolicy.defaults() : authority;
        auditSigningSecret = auditSigningSecret == null ? "" : auditSigningSecret;
    }

    public static BrokerSettings defaults() {
        return new BrokerSettings(
                DEFAULT_MAILBOX_CAPACITY,
                List.of(
                        new AgentSpec("planner_agent", DEFAULT_MAILBOX_CAPACITY),
                        new AgentSpec("executor_agent", DEFAULT_MAILBOX_CAPACITY),
                        new AgentSpec("evaluator_agent", DEFAULT_MAILBOX_CAPACITY),
                        new AgentSpec(DEFAULT_OVERSEER, OVERSEER_MAILBOX_CAPACITY)
                ),
                OversightPolicy.DEFAULT_KINDS.stream().sorted().toList(),
                DEFAULT_OVERSEER,
                0L,
                true,
                AuthorityPolicy.defaults(),
                "",
                DEFAULT_MAX_TRACKED_TASK_REQUESTS
        );
    }

    public static BrokerSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read broker settings: " + settingsFile, e);
        }
    }

    static BrokerSettings fromFile(SettingsFile file, BrokerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int defaultCapacity = sanitizeInt(file.defaultMailboxCapacity(), defaults.defaultMailboxCapacity(), 1);
        List<AgentSpec> agents = defaults.agents();
        if (file.agents() != null) {
            Map<String, AgentSpec> unique = new LinkedHashMap<>();
            for (AgentSpecFile raw : file.agents()) {
                if (raw == null || raw.id() == null || raw.id().isBlank()) {
                    continue;
                }
                String id = raw.id().trim();
                unique.put(id, new AgentSpec(id, sanitizeInt(raw.capacity(), defaultCapacity, 1)));
            }
            agents = new ArrayList<>(unique.values());
        }
        List<String> kinds = file.oversightConversationKinds() == null
                ? defaults.oversightConversationKinds()
                : OversightPolicy.of(file.oversightConversationKinds()).kinds().stream().sorted().toList();
        String overseer = file.overseerAgent() == null ? defaults.overseerAgent() : file.overseerAgent().trim();
        return new BrokerSettings(
                defaultCapacity,
                agents,
                kinds,
                overseer.isEmpty() ? null : overseer,
                sanitizeLong(file.conversationIdleTimeoutMs(), defaults.conversationIdleTimeoutMs(), 0L),
                sanitizeBoolean(file.authorityChecksEnabled(), defaults.authorityChecksEnabled()),
                file.authority() == null ? defaults.authority() : file.authority(),
                sanitizeSecret(file.auditSigningSecret(), defaults.auditSigningSecret()),
                sanitizeInt(file.maxTrackedTaskRequests(), defaults.maxTrackedTaskRequests(), 1)
        );
    }

    public OversightPolicy oversightPolicy() {
        return OversightPolicy.of(oversightConversationKinds);
    }

    public record AgentSpec(String id, int capacity) {
    }

    record AgentSpecFile(String id, Integer capacity) {
    }

    record SettingsFile(
            Integer defaultMailboxCapacity,
            List<AgentSpecFile> agents,
            List<String> oversightConversationKinds,
            String overseerAgent,
            Long conversationIdleTimeoutMs,
            Boolean authorityChecksEnabled,
            AuthorityPolicy authority,
            String auditSigningSecret,
            Integer maxTrackedTaskRequests
    ) {
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static String sanitizeSecret(String raw, String fallback) {
        if (raw == null) {
            return fallback == null ? "" : fallback;
        }
        return raw.trim();
    }
}
