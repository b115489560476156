package io.agentrelay.runtime;

import io.agentrelay.authority.PermitAllValidator;
import io.agentrelay.authority.RoleAuthorityValidator;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.config.BrokerSettings;
import io.agentrelay.conversation.IdleTimeoutPolicy;
import io.agentrelay.model.DeliveryResult;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.OutboundMessage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AgentRelayRuntimeTest {

    @Test
    void stateSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-reopen-");
        try {
            String requestId;
            String conversationId;
            try (AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()))) {
                AgentRelayRuntime.InitOutcome outcome = runtime.init();
                Assertions.assertFalse(outcome.restored());
                Assertions.assertEquals(
                        List.of("evaluator_agent", "executor_agent", "overwatch_agent", "planner_agent"),
                        outcome.agents());
                requestId = runtime.broker().send(OutboundMessage
                        .taskRequest("planner_agent", "executor_agent", "execution", Map.of("job", "deploy"))
                        .withAuthorityCheck()).envelopeId();
                conversationId = runtime.broker().startConversation("sync",
                        List.of("planner_agent", "executor_agent"), "planner_agent");
            }

            try (AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()))) {
                AgentRelayRuntime.InitOutcome outcome = runtime.init();
                Assertions.assertTrue(outcome.restored());
                Assertions.assertTrue(outcome.registered().isEmpty());
                Assertions.assertTrue(outcome.conflicts().isEmpty());

                Envelope request = runtime.broker().receive("executor_agent").orElseThrow();
                Assertions.assertEquals(requestId, request.id());
                Assertions.assertEquals("deploy", request.payload().get("job"));
                Assertions.assertTrue(runtime.broker().conversationStatus(conversationId).active());
                DeliveryResult response = runtime.broker().send(
                        OutboundMessage.taskResponse("executor_agent", "planner_agent", requestId, Map.of("ok", true)));
                Assertions.assertTrue(response.success());
                Assertions.assertTrue(runtime.auditSink().verify().ok());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void persistedCapacityWinsOverChangedSettings() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-conflict-");
        try {
            writeSettings(root, "{\"agents\": [{\"id\": \"scout\", \"capacity\": 3}]}");
            try (AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()))) {
                Assertions.assertEquals(List.of("scout"), runtime.init().registered());
            }

            writeSettings(root, "{\"agents\": [{\"id\": \"scout\", \"capacity\": 8}, {\"id\": \"courier\"}]}");
            try (AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()))) {
                AgentRelayRuntime.InitOutcome outcome = runtime.init();
                Assertions.assertEquals(List.of("courier"), outcome.registered());
                Assertions.assertTrue(outcome.conflicts().containsKey("scout"));
                Assertions.assertEquals(3, runtime.broker().queueStatus("scout").capacity());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void authorityChecksFollowSettings() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-authority-");
        try {
            try (AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                DeliveryResult denied = runtime.broker().send(OutboundMessage
                        .taskRequest("planner_agent", "evaluator_agent", "override", Map.of())
                        .withAuthorityCheck());
                Assertions.assertTrue(denied.denied());
            }

            writeSettings(root, "{\"authorityChecksEnabled\": false}");
            try (AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                DeliveryResult allowed = runtime.broker().send(OutboundMessage
                        .taskRequest("planner_agent", "evaluator_agent", "override", Map.of())
                        .withAuthorityCheck());
                Assertions.assertTrue(allowed.success());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void validatorAndTimeoutFollowSettings() {
        BrokerSettings defaults = BrokerSettings.defaults();
        Assertions.assertInstanceOf(RoleAuthorityValidator.class, AgentRelayRuntime.validatorFor(defaults));
        BrokerSettings open = new BrokerSettings(10, List.of(), List.of(), null, 60_000L, false, null, null, 500);
        Assertions.assertInstanceOf(PermitAllValidator.class, AgentRelayRuntime.validatorFor(open));
        IdleTimeoutPolicy idle = Assertions.assertInstanceOf(IdleTimeoutPolicy.class, AgentRelayRuntime.timeoutPolicyFor(open));
        Assertions.assertEquals(60_000L, idle.idleMs());
    }

    @Test
    void initTwiceFails() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-test-runtime-twice-");
        try {
            try (AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.fromRoot(root.toString()))) {
                runtime.init();
                Assertions.assertThrows(IllegalStateException.class, runtime::init);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static void writeSettings(Path root, String json) throws IOException {
        Files.writeString(root.resolve("agentrelay-settings.json"), json, StandardCharsets.UTF_8);
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
