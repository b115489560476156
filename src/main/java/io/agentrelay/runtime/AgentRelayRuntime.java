package io.agentrelay.runtime;

import io.agentrelay.authority.AuthorityValidator;
import io.agentrelay.authority.PermitAllValidator;
import io.agentrelay.authority.RoleAuthorityValidator;
import io.agentrelay.broker.AgentBroker;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.config.BrokerSettings;
import io.agentrelay.conversation.ConversationTimeoutPolicy;
import io.agentrelay.conversation.IdleTimeoutPolicy;
import io.agentrelay.model.BrokerException;
import io.agentrelay.model.BrokerSnapshot;
import io.agentrelay.observability.AuditEvent;
import io.agentrelay.observability.JsonlAuditSink;
import io.agentrelay.storage.Database;
import io.agentrelay.storage.PersistentStore;
import io.agentrelay.storage.SqliteBrokerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One broker bound to a data root: settings, audit file and SQLite snapshot.
 * {@link #init()} restores the last snapshot and registers the configured agents;
 * {@link #close()} shuts the broker down and persists its state.
 */
public final class AgentRelayRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentRelayRuntime.class);

    private final AgentRelayConfig config;
    private final BrokerSettings settings;
    private final JsonlAuditSink auditSink;
    private final Database database;
    private final PersistentStore store;
    private final AgentBroker broker;
    private final Clock clock;
    private boolean initialized;
    private boolean closed;

    public AgentRelayRuntime(AgentRelayConfig config) {
        this(config, Clock.systemUTC());
    }

    public AgentRelayRuntime(AgentRelayConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.settings = BrokerSettings.load(config.settingsFile());
        this.database = new Database(config);
        this.store = new SqliteBrokerStore(database);
        this.auditSink = new JsonlAuditSink(config.auditFile(), config.namespace(), settings.auditSigningSecret());
        this.broker = new AgentBroker(
                validatorFor(settings),
                auditSink,
                settings.oversightPolicy(),
                timeoutPolicyFor(settings),
                settings.overseerAgent(),
                clock,
                settings.maxTrackedTaskRequests()
        );
        this.initialized = false;
        this.closed = false;
    }

    public synchronized InitOutcome init() {
        if (initialized) {
            throw new IllegalStateException("runtime already initialized");
        }
        database.init();
        Optional<BrokerSnapshot> snapshot = store.load();
        snapshot.ifPresent(broker::restore);
        List<String> registered = new ArrayList<>();
        Map<String, String> conflicts = new LinkedHashMap<>();
        for (BrokerSettings.AgentSpec agent : settings.agents()) {
            try {
                if (broker.registerAgent(agent.id(), agent.capacity())) {
                    registered.add(agent.id());
                }
            } catch (BrokerException e) {
                log.warn("Configured agent {} kept its persisted mailbox: {}", agent.id(), e.getMessage());
                conflicts.put(agent.id(), e.getMessage());
            }
        }
        auditSink.record(AuditEvent.of(
                "runtime.init",
                AgentBroker.SYSTEM_SENDER,
                "runtime/" + config.namespace(),
                "ok",
                clock.millis(),
                Map.of(
                        "restored", snapshot.isPresent(),
                        "registered", registered,
                        "conflicts", List.copyOf(conflicts.keySet())
                )
        ));
        initialized = true;
        log.info("Runtime ready namespace={} root={} restored={} agents={}",
                config.namespace(), config.rootDir(), snapshot.isPresent(), broker.registeredAgents().size());
        return new InitOutcome(
                config.namespace(),
                config.rootDir().toString(),
                snapshot.isPresent(),
                registered,
                conflicts,
                broker.registeredAgents()
        );
    }

    public AgentBroker broker() {
        return broker;
    }

    public BrokerSettings settings() {
        return settings;
    }

    public AgentRelayConfig config() {
        return config;
    }

    public JsonlAuditSink auditSink() {
        return auditSink;
    }

    public void persist() {
        store.save(broker.snapshot());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        broker.shutdown();
        if (initialized) {
            persist();
        }
    }

    static AuthorityValidator validatorFor(BrokerSettings settings) {
        if (!settings.authorityChecksEnabled()) {
            return new PermitAllValidator();
        }
        return new RoleAuthorityValidator(settings.authority());
    }

    static ConversationTimeoutPolicy timeoutPolicyFor(BrokerSettings settings) {
        if (settings.conversationIdleTimeoutMs() <= 0L) {
            return ConversationTimeoutPolicy.never();
        }
        return new IdleTimeoutPolicy(settings.conversationIdleTimeoutMs());
    }

    public record InitOutcome(
            String namespace,
            String rootDir,
            boolean restored,
            List<String> registered,
            Map<String, String> conflicts,
            List<String> agents
    ) {
    }
}
