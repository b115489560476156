package io.agentrelay.config;

import io.agentrelay.authority.AuthorityPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class BrokerSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-settings-default-");
        try {
            BrokerSettings settings = BrokerSettings.load(root.resolve("agentrelay-settings.json"));
            Assertions.assertEquals(BrokerSettings.defaults(), settings);
            Assertions.assertEquals(4, settings.agents().size());
            Assertions.assertEquals(new BrokerSettings.AgentSpec("overwatch_agent", BrokerSettings.OVERSEER_MAILBOX_CAPACITY),
                    settings.agents().get(3));
            Assertions.assertTrue(settings.oversightPolicy().requiresOversight("crisis_management"));
            Assertions.assertTrue(settings.authorityChecksEnabled());
            Assertions.assertEquals(BrokerSettings.DEFAULT_MAX_TRACKED_TASK_REQUESTS, settings.maxTrackedTaskRequests());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileOverridesAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-settings-file-");
        try {
            Path file = root.resolve("agentrelay-settings.json");
            Files.writeString(file, """
                    {
                      "defaultMailboxCapacity": 0,
                      "agents": [
                        {"id": " scout ", "capacity": 5},
                        {"id": "scout", "capacity": 7},
                        {"id": "", "capacity": 9},
                        {"id": "courier"}
                      ],
                      "oversightConversationKinds": [" Budget_Review "],
                      "overseerAgent": "  ",
                      "conversationIdleTimeoutMs": -10,
                      "authorityChecksEnabled": false,
                      "authority": {
                        "roles": {"scout": ["recon"]},
                        "deny": [{"from": ["*"], "to": ["courier"], "taskTypes": [], "violation": "courier is receive-only"}]
                      },
                      "auditSigningSecret": " s3cret ",
                      "maxTrackedTaskRequests": 0,
                      "unknownField": true
                    }
                    """, StandardCharsets.UTF_8);

            BrokerSettings settings = BrokerSettings.load(file);

            Assertions.assertEquals(1, settings.defaultMailboxCapacity());
            Assertions.assertEquals(List.of(
                    new BrokerSettings.AgentSpec("scout", 7),
                    new BrokerSettings.AgentSpec("courier", 1)
            ), settings.agents());
            Assertions.assertEquals(List.of("budget_review"), settings.oversightConversationKinds());
            Assertions.assertNull(settings.overseerAgent());
            Assertions.assertEquals(0L, settings.conversationIdleTimeoutMs());
            Assertions.assertFalse(settings.authorityChecksEnabled());
            AuthorityPolicy authority = settings.authority();
            Assertions.assertEquals(List.of("recon"), authority.roles().get("scout"));
            Assertions.assertEquals("courier is receive-only", authority.deny().get(0).violation());
            Assertions.assertTrue(authority.allow().isEmpty());
            Assertions.assertEquals("s3cret", settings.auditSigningSecret());
            Assertions.assertEquals(1, settings.maxTrackedTaskRequests());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-settings-bad-");
        try {
            Path file = root.resolve("agentrelay-settings.json");
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            RuntimeException error = Assertions.assertThrows(RuntimeException.class, () -> BrokerSettings.load(file));
            Assertions.assertTrue(error.getMessage().startsWith("Failed to read broker settings"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void namespacesAreSanitizedAndScoped() {
        Assertions.assertEquals("default", AgentRelayConfig.sanitizeNamespace(null));
        Assertions.assertEquals("team-a", AgentRelayConfig.sanitizeNamespace(" Team A "));
        Assertions.assertEquals("ns.hidden", AgentRelayConfig.sanitizeNamespace(".hidden"));
        Assertions.assertEquals("default", AgentRelayConfig.sanitizeNamespace("///"));

        AgentRelayConfig base = AgentRelayConfig.fromRoot("build/relay-data");
        AgentRelayConfig scoped = AgentRelayConfig.fromRoot("build/relay-data", "Team A");
        Assertions.assertEquals(Path.of("build/relay-data").toAbsolutePath().normalize(), base.rootDir());
        Assertions.assertEquals(base.rootDir().resolve("namespaces").resolve("team-a"), scoped.rootDir());
        Assertions.assertEquals(scoped.rootDir().resolve("agentrelay.db"), scoped.dbFile());
        Assertions.assertEquals(scoped.rootDir().resolve("audit").resolve("audit.log"), scoped.auditFile());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
