package io.agentrelay.cli;

import io.agentrelay.broker.AgentBroker;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.model.BroadcastTargets;
import io.agentrelay.model.BrokerException;
import io.agentrelay.model.ConversationView;
import io.agentrelay.model.DeliveryResult;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.EnvelopeKind;
import io.agentrelay.model.OutboundMessage;
import io.agentrelay.model.Priority;
import io.agentrelay.observability.JsonlAuditSink;
import io.agentrelay.runtime.AgentRelayRuntime;
import io.agentrelay.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "agent-relay",
        mixinStandardHelpOptions = true,
        description = "AgentRelay message broker CLI",
        subcommands = {
                AgentRelayCommand.InitCommand.class,
                AgentRelayCommand.AgentsCommand.class,
                AgentRelayCommand.RegisterCommand.class,
                AgentRelayCommand.SendCommand.class,
                AgentRelayCommand.ReceiveCommand.class,
                AgentRelayCommand.QueueStatusCommand.class,
                AgentRelayCommand.ConversationStartCommand.class,
                AgentRelayCommand.ConversationSendCommand.class,
                AgentRelayCommand.ConversationStatusCommand.class,
                AgentRelayCommand.ConversationCloseCommand.class,
                AgentRelayCommand.ConversationExpireCommand.class,
                AgentRelayCommand.EmergencyCommand.class,
                AgentRelayCommand.StatsCommand.class,
                AgentRelayCommand.AuditTailCommand.class,
                AgentRelayCommand.AuditVerifyCommand.class
        }
)
public final class AgentRelayCommand implements Runnable {
    static final int EXIT_BROKER_ERROR = 2;

    @Option(names = {"--root"}, description = "Broker data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Broker namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | agents | register | send | receive | queue-status | conversation-start | conversation-send | conversation-status | conversation-close | conversation-expire | emergency | stats | audit-tail | audit-verify");
    }

    /**
     * Command line with broker errors mapped to exit code 2 and a JSON error body.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new AgentRelayCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof BrokerException) {
                BrokerException broker = (BrokerException) ex;
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", broker.code().wireName());
                body.put("message", broker.getMessage());
                commandLine.getErr().println(Jsons.toJson(body));
                commandLine.getErr().flush();
                return EXIT_BROKER_ERROR;
            }
            if (ex instanceof IllegalArgumentException) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", "invalid_argument");
                body.put("message", ex.getMessage());
                commandLine.getErr().println(Jsons.toJson(body));
                commandLine.getErr().flush();
                return commandLine.getCommandSpec().exitCodeOnInvalidInput();
            }
            throw ex;
        });
        return cmd;
    }

    AgentRelayRuntime runtime() {
        AgentRelayConfig config = AgentRelayConfig.fromRoot(root, namespace);
        return new AgentRelayRuntime(config);
    }

    @Command(name = "init", description = "Initialize data root, SQLite schema and configured agents")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                AgentRelayRuntime.InitOutcome outcome = runtime.init();
                System.out.println(Jsons.toJson(outcome));
            }
            return 0;
        }
    }

    @Command(name = "agents", description = "List registered agents with mailbox status")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.broker().queueStatuses()));
            }
            return 0;
        }
    }

    @Command(name = "register", description = "Register an agent mailbox")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--capacity"}, description = "Mailbox capacity (default from settings)")
        Integer capacity;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                int resolved = capacity == null ? runtime.settings().defaultMailboxCapacity() : capacity;
                boolean created = runtime.broker().registerAgent(agent, resolved);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("agent", agent);
                out.put("capacity", resolved);
                out.put("created", created);
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "send", description = "Send one envelope")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--kind"}, required = true, description = "task_request|task_response|agent_message|broadcast")
        String kind;

        @Option(names = {"--sender"}, required = true, description = "Sending agent id")
        String sender;

        @Option(names = {"--target"}, description = "Target agent id for directed kinds")
        String target;

        @Option(names = {"--targets"}, split = ",", description = "Explicit broadcast targets")
        List<String> targets;

        @Option(names = {"--all"}, description = "Broadcast to every registered agent")
        boolean all;

        @Option(names = {"--priority"}, defaultValue = "routine", description = "routine|elevated|critical|urgent")
        String priority;

        @Option(names = {"--payload"}, description = "Payload JSON object")
        String payload;

        @Option(names = {"--task-type"}, description = "Task type placed into payload.task_type")
        String taskType;

        @Option(names = {"--request-id"}, description = "Originating request id for task_response")
        String requestId;

        @Option(names = {"--conversation"}, description = "Conversation id")
        String conversationId;

        @Option(names = {"--authority-check"}, description = "Run the authority validator before routing")
        boolean authorityCheck;

        @Option(names = {"--expires-at-ms"}, description = "Absolute expiry in epoch milliseconds")
        Long expiresAtMs;

        @Override
        public Integer call() {
            Map<String, Object> body = new LinkedHashMap<>(Jsons.toMap(payload));
            if (taskType != null && !taskType.isBlank()) {
                body.put(OutboundMessage.TASK_TYPE, taskType.trim());
            }
            EnvelopeKind resolvedKind = EnvelopeKind.fromString(kind);
            BroadcastTargets rule = null;
            if (all) {
                rule = BroadcastTargets.allAgents();
            } else if (targets != null) {
                rule = BroadcastTargets.of(targets);
            }
            OutboundMessage draft = new OutboundMessage(
                    resolvedKind,
                    sender,
                    target,
                    rule,
                    Priority.fromString(priority),
                    body,
                    authorityCheck,
                    conversationId,
                    requestId,
                    expiresAtMs
            );
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                DeliveryResult result = runtime.broker().send(draft);
                System.out.println(Jsons.toJson(result));
                return result.success() ? 0 : 1;
            }
        }
    }

    @Command(name = "receive", description = "Take envelopes from an agent mailbox (non-blocking)")
    static final class ReceiveCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Receiving agent id")
        String agent;

        @Option(names = {"--max"}, defaultValue = "1", description = "Maximum envelopes to take")
        int max;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                List<Envelope> received = new ArrayList<>();
                for (int i = 0; i < Math.max(1, max); i++) {
                    Optional<Envelope> next = runtime.broker().receive(agent);
                    if (next.isEmpty()) {
                        break;
                    }
                    received.add(next.get());
                }
                System.out.println(Jsons.toJson(received));
            }
            return 0;
        }
    }

    @Command(name = "queue-status", description = "Show mailbox status of one agent")
    static final class QueueStatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.broker().queueStatus(agent)));
            }
            return 0;
        }
    }

    @Command(name = "conversation-start", description = "Start a conversation and invite participants")
    static final class ConversationStartCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--kind"}, description = "Conversation kind")
        String kind;

        @Option(names = {"--initiator"}, required = true, description = "Initiating agent (must be a participant)")
        String initiator;

        @Option(names = {"--participants"}, required = true, split = ",", description = "Participant agent ids")
        List<String> participants;

        @Option(names = {"--topic"}, description = "Optional topic")
        String topic;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                AgentBroker broker = runtime.broker();
                String conversationId = broker.startConversation(kind, participants, initiator, topic);
                System.out.println(Jsons.toJson(broker.conversationStatus(conversationId)));
            }
            return 0;
        }
    }

    @Command(name = "conversation-send", description = "Send a message to every other participant of a conversation")
    static final class ConversationSendCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--id"}, required = true, description = "Conversation id")
        String conversationId;

        @Option(names = {"--sender"}, required = true, description = "Sending participant")
        String sender;

        @Option(names = {"--priority"}, defaultValue = "routine", description = "routine|elevated|critical|urgent")
        String priority;

        @Option(names = {"--payload"}, description = "Payload JSON object")
        String payload;

        @Option(names = {"--authority-check"}, description = "Run the authority validator before routing")
        boolean authorityCheck;

        @Override
        public Integer call() {
            Map<String, Object> body = Jsons.toMap(payload);
            Priority resolvedPriority = Priority.fromString(priority);
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                DeliveryResult result = runtime.broker().sendInConversation(
                        conversationId.trim(), sender, body, resolvedPriority, authorityCheck);
                System.out.println(Jsons.toJson(result));
                return result.success() ? 0 : 1;
            }
        }
    }

    @Command(name = "conversation-status", description = "Show one conversation, or all when no id is given")
    static final class ConversationStatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--id"}, description = "Conversation id")
        String conversationId;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                if (conversationId == null || conversationId.isBlank()) {
                    System.out.println(Jsons.toJson(runtime.broker().conversations()));
                } else {
                    System.out.println(Jsons.toJson(runtime.broker().conversationStatus(conversationId.trim())));
                }
            }
            return 0;
        }
    }

    @Command(name = "conversation-close", description = "Close a conversation")
    static final class ConversationCloseCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--id"}, required = true, description = "Conversation id")
        String conversationId;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                ConversationView closed = runtime.broker().closeConversation(conversationId.trim());
                System.out.println(Jsons.toJson(closed));
            }
            return 0;
        }
    }

    @Command(name = "conversation-expire", description = "Close conversations idle beyond the configured timeout")
    static final class ConversationExpireCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("closed", runtime.broker().expireConversations());
                out.put("idleTimeoutMs", runtime.settings().conversationIdleTimeoutMs());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "emergency", description = "Broadcast an urgent emergency event to every agent")
    static final class EmergencyCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--sender"}, description = "Sender (default: configured overseer)")
        String sender;

        @Option(names = {"--description"}, required = true, description = "What happened")
        String description;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                DeliveryResult result = runtime.broker().broadcastEmergency(sender, description);
                System.out.println(Jsons.toJson(result));
                return result.success() ? 0 : 1;
            }
        }
    }

    @Command(name = "stats", description = "Show broker counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.broker().stats()));
            }
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                for (String row : runtime.auditSink().tail(lines)) {
                    System.out.println(row);
                }
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                JsonlAuditSink.IntegrityReport report = runtime.auditSink().verify();
                System.out.println(Jsons.toJson(report));
                return report.ok() ? 0 : 1;
            }
        }
    }
}
