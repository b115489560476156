package io.agentrelay.broker;

import io.agentrelay.authority.AuthorityValidator;
import io.agentrelay.authority.ValidationOutcome;
import io.agentrelay.conversation.ConversationRegistry;
import io.agentrelay.conversation.ConversationTimeoutPolicy;
import io.agentrelay.conversation.OversightPolicy;
import io.agentrelay.mailbox.EnqueueResult;
import io.agentrelay.mailbox.Mailbox;
import io.agentrelay.model.BrokerException;
import io.agentrelay.model.BrokerSnapshot;
import io.agentrelay.model.ConversationView;
import io.agentrelay.model.DeliveryResult;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.EnvelopeKind;
import io.agentrelay.model.ErrorCode;
import io.agentrelay.model.OutboundMessage;
import io.agentrelay.model.Priority;
import io.agentrelay.model.QueueStatus;
import io.agentrelay.observability.AuditEvent;
import io.agentrelay.observability.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes envelopes between registered agents.
 *
 * <p>The broker owns every mailbox and the conversation registry; agents only
 * hold ids. The only broker-wide structures are the agent and conversation
 * maps, both concurrent. Each mailbox and each conversation guards its own
 * state, so a broadcast is a series of independent enqueues and partial
 * delivery is a reported outcome, not an error.
 */
public final class AgentBroker {
    public static final String SYSTEM_SENDER = "system";
    public static final String CONVERSATION_INVITE = "conversation_invite";
    public static final String OVERSIGHT_NOTICE = "oversight_notice";
    public static final String STATUS_UPDATE = "status_update";
    public static final String CONVERSATION_MESSAGE = "conversation_message";
    public static final String EMERGENCY = "emergency";
    public static final int DEFAULT_MAX_TASK_REQUESTS = 10_000;
    public static final String UNKNOWN_AGENT = "unknown_agent";

    private static final Logger log = LoggerFactory.getLogger(AgentBroker.class);

    private final ConcurrentMap<String, Mailbox> mailboxes;
    private final ConcurrentMap<String, BrokerSnapshot.TaskRequestRecord> taskRequests;
    private final Queue<String> taskRequestOrder;
    private final int maxTaskRequests;
    private final ConcurrentMap<String, Long> lastCreatedAtBySender;
    private final ConversationRegistry conversations;
    private final AuthorityValidator validator;
    private final AuditSink auditSink;
    private final ConversationTimeoutPolicy timeoutPolicy;
    private final String overseerAgent;
    private final Clock clock;
    private final AtomicBoolean shutDown;
    private final AtomicLong routedTotal;
    private final AtomicLong deniedTotal;
    private final AtomicLong malformedTotal;
    private final AtomicLong droppedInviteTotal;
    private final AtomicLong droppedNoticeTotal;
    private final AtomicLong auditFailureTotal;

    public AgentBroker(AuthorityValidator validator, AuditSink auditSink) {
        this(validator, auditSink, OversightPolicy.defaults(), ConversationTimeoutPolicy.never(), null, Clock.systemUTC());
    }

    public AgentBroker(
            AuthorityValidator validator,
            AuditSink auditSink,
            OversightPolicy oversightPolicy,
            ConversationTimeoutPolicy timeoutPolicy,
            String overseerAgent,
            Clock clock
    ) {
        this(validator, auditSink, oversightPolicy, timeoutPolicy, overseerAgent, clock, DEFAULT_MAX_TASK_REQUESTS);
    }

    public AgentBroker(
            AuthorityValidator validator,
            AuditSink auditSink,
            OversightPolicy oversightPolicy,
            ConversationTimeoutPolicy timeoutPolicy,
            String overseerAgent,
            Clock clock,
            int maxTaskRequests
    ) {
        if (validator == null) {
            throw new IllegalArgumentException("authority validator is required");
        }
        if (maxTaskRequests <= 0) {
            throw new IllegalArgumentException("task request ledger bound must be positive: " + maxTaskRequests);
        }
        this.mailboxes = new ConcurrentHashMap<>();
        this.taskRequests = new ConcurrentHashMap<>();
        this.taskRequestOrder = new ArrayDeque<>();
        this.maxTaskRequests = maxTaskRequests;
        this.lastCreatedAtBySender = new ConcurrentHashMap<>();
        this.conversations = new ConversationRegistry(oversightPolicy, clock);
        this.validator = validator;
        this.auditSink = auditSink == null ? AuditSink.discarding() : auditSink;
        this.timeoutPolicy = timeoutPolicy == null ? ConversationTimeoutPolicy.never() : timeoutPolicy;
        this.overseerAgent = overseerAgent == null || overseerAgent.isBlank() ? null : overseerAgent.trim();
        this.clock = clock;
        this.shutDown = new AtomicBoolean(false);
        this.routedTotal = new AtomicLong(0L);
        this.deniedTotal = new AtomicLong(0L);
        this.malformedTotal = new AtomicLong(0L);
        this.droppedInviteTotal = new AtomicLong(0L);
        this.droppedNoticeTotal = new AtomicLong(0L);
        this.auditFailureTotal = new AtomicLong(0L);
    }

    /**
     * Creates the agent's mailbox. Repeating the call with the same capacity is a
     * no-op and returns {@code false}; a different capacity fails.
     */
    public boolean registerAgent(String agentId, int mailboxCapacity) {
        ensureOpen();
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        String id = agentId.trim();
        Mailbox candidate = new Mailbox(id, mailboxCapacity, clock);
        Mailbox existing = mailboxes.putIfAbsent(id, candidate);
        if (existing == null) {
            log.info("Registered agent {} with mailbox capacity {}", id, mailboxCapacity);
            emit(AuditEvent.of("agent.register", SYSTEM_SENDER, "agent/" + id, "registered", clock.millis(),
                    Map.of("capacity", mailboxCapacity)));
            return true;
        }
        if (existing.capacity() == mailboxCapacity) {
            return false;
        }
        throw new BrokerException(
                ErrorCode.ALREADY_REGISTERED,
                "Agent " + id + " already registered with capacity " + existing.capacity()
        );
    }

    public DeliveryResult send(OutboundMessage draft) {
        ensureOpen();
        try {
            EnvelopeShapes.check(draft);
            checkReferences(draft);
        } catch (BrokerException e) {
            if (e.code() == ErrorCode.MALFORMED_ENVELOPE) {
                malformedTotal.incrementAndGet();
            }
            log.debug("Rejected envelope from {}: {}", draft == null ? null : draft.sender(), e.getMessage());
            throw e;
        }

        Envelope envelope = admit(draft);
        String validation = AuditEvent.VALIDATION_NOT_REQUIRED;
        if (envelope.requiresAuthorityCheck()) {
            ValidationOutcome outcome = runValidator(envelope);
            if (!outcome.allowed()) {
                deniedTotal.incrementAndGet();
                log.info("Authority denied envelope {} from {}: {}", envelope.id(), envelope.sender(), outcome.violations());
                emit(AuditEvent.denied(envelope, outcome.violations(), clock.millis()));
                return DeliveryResult.denied(envelope.id(), envelope.kind(), outcome.violations());
            }
            validation = AuditEvent.VALIDATION_ALLOWED;
        }

        List<String> targets = resolveTargets(envelope);
        Map<String, Boolean> perTarget = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String target : targets) {
            Mailbox mailbox = mailboxes.get(target);
            if (mailbox == null) {
                perTarget.put(target, false);
                failures.put(target, UNKNOWN_AGENT);
                continue;
            }
            EnqueueResult enqueued = mailbox.enqueue(envelope);
            perTarget.put(target, enqueued.accepted());
            if (!enqueued.accepted()) {
                failures.put(target, enqueued.reason());
            }
        }
        DeliveryResult result = DeliveryResult.routed(envelope.id(), envelope.kind(), perTarget, failures);
        routedTotal.incrementAndGet();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("priority", envelope.priority().label());
        details.put("successful_count", result.successfulCount());
        details.put("total_targets", result.totalTargets());
        details.put("delivery_rate", result.deliveryRate());
        if (result.successfulCount() > 0) {
            if (envelope.kind() == EnvelopeKind.TASK_REQUEST) {
                trackTaskRequest(new BrokerSnapshot.TaskRequestRecord(
                        envelope.id(), envelope.sender(), envelope.target(), envelope.createdAtMs()));
            }
            if (envelope.conversationId() != null) {
                ConversationView conversation = recordConversationActivity(envelope);
                if (conversation != null) {
                    details.put("conversation_message_count", conversation.messageCount());
                    if (conversation.oversightRequired()) {
                        details.put("overseer_notified", notifyOverseer(envelope, targets));
                    }
                }
            }
        }
        emit(AuditEvent.routed(envelope, result, validation, clock.millis(), details));
        log.debug("Routed {} {} from {} -> {} ({}/{})", envelope.kind().wireName(), envelope.id(),
                envelope.sender(), perTarget, result.successfulCount(), result.totalTargets());
        return result;
    }

    /**
     * Non-blocking poll of the agent's mailbox.
     */
    public Optional<Envelope> receive(String agentId) {
        ensureOpen();
        return requireMailbox(agentId).dequeue();
    }

    /**
     * Sends one message to every participant of an active conversation except the
     * sender. Per-participant outcomes are reported the same way as for an
     * explicit broadcast, and the message counts as conversation activity once at
     * least one participant accepted it.
     */
    public DeliveryResult sendInConversation(
            String conversationId,
            String sender,
            Map<String, Object> body,
            Priority priority,
            boolean requiresAuthorityCheck
    ) {
        ensureOpen();
        ConversationView conversation = conversations.requireActive(conversationId);
        if (sender == null || !conversation.participants().contains(sender)) {
            throw new BrokerException(
                    ErrorCode.INVALID_PARTICIPANTS,
                    "Agent " + sender + " is not a participant of conversation " + conversation.id()
            );
        }
        List<String> recipients = new ArrayList<>();
        for (String participant : conversation.participants()) {
            if (!participant.equals(sender)) {
                recipients.add(participant);
            }
        }
        if (recipients.isEmpty()) {
            throw new BrokerException(
                    ErrorCode.INVALID_PARTICIPANTS,
                    "Conversation " + conversation.id() + " has no participant other than " + sender
            );
        }
        Map<String, Object> message = new LinkedHashMap<>();
        if (body != null) {
            message.putAll(body);
        }
        message.putIfAbsent(OutboundMessage.SUBTYPE, CONVERSATION_MESSAGE);
        OutboundMessage draft = OutboundMessage.broadcast(sender, recipients, message)
                .withPriority(priority)
                .inConversation(conversation.id());
        return send(requiresAuthorityCheck ? draft.withAuthorityCheck() : draft);
    }

    public String startConversation(String kind, List<String> participants, String initiator) {
        return startConversation(kind, participants, initiator, null);
    }

    /**
     * Creates the conversation and invites every participant except the
     * initiator. Invitations are best-effort: an invite that cannot be enqueued
     * is counted and logged, and the conversation still exists.
     */
    public String startConversation(String kind, List<String> participants, String initiator, String topic) {
        ensureOpen();
        ConversationView conversation = conversations.create(kind, participants, initiator, topic);
        Map<String, String> outcomes = new LinkedHashMap<>();
        int dropped = 0;
        for (String participant : conversation.participants()) {
            if (participant.equals(conversation.initiator())) {
                continue;
            }
            Mailbox mailbox = mailboxes.get(participant);
            if (mailbox == null) {
                outcomes.put(participant, UNKNOWN_AGENT);
                dropped++;
                continue;
            }
            Map<String, Object> invite = new LinkedHashMap<>();
            invite.put(OutboundMessage.SUBTYPE, CONVERSATION_INVITE);
            invite.put("conversation_kind", conversation.kind());
            invite.put("initiator", conversation.initiator());
            invite.put("participants", conversation.participants());
            invite.put("oversight_required", conversation.oversightRequired());
            if (conversation.topic() != null) {
                invite.put("topic", conversation.topic());
            }
            Envelope envelope = admit(OutboundMessage
                    .agentMessage(conversation.initiator(), participant, invite)
                    .inConversation(conversation.id()));
            EnqueueResult enqueued = mailbox.enqueue(envelope);
            outcomes.put(participant, enqueued.accepted() ? "delivered" : enqueued.reason());
            if (!enqueued.accepted()) {
                dropped++;
            }
        }
        if (dropped > 0) {
            droppedInviteTotal.addAndGet(dropped);
            log.warn("Conversation {} started with {} undelivered invite(s): {}", conversation.id(), dropped, outcomes);
        }
        emit(new AuditEvent(
                "conversation.start",
                conversation.initiator(),
                conversation.id(),
                dropped == 0 ? "started" : "started_partial_invites",
                null,
                new ArrayList<>(outcomes.keySet()),
                outcomes,
                null,
                List.of(),
                conversation.id(),
                clock.millis(),
                Map.of("conversation_kind", conversation.kind(), "oversight_required", conversation.oversightRequired())
        ));
        return conversation.id();
    }

    public ConversationView conversationStatus(String conversationId) {
        return conversations.get(conversationId)
                .orElseThrow(() -> BrokerException.notFound("Conversation not found: " + conversationId));
    }

    public List<ConversationView> conversations() {
        return conversations.list();
    }

    public ConversationView addParticipant(String conversationId, String agentId) {
        ensureOpen();
        return conversations.addParticipant(conversationId, agentId);
    }

    public ConversationView closeConversation(String conversationId) {
        ConversationView closed = conversations.close(conversationId);
        emit(AuditEvent.of("conversation.close", SYSTEM_SENDER, conversationId, "closed", clock.millis(),
                Map.of("message_count", closed.messageCount())));
        return closed;
    }

    /**
     * Applies the configured timeout hook to every active conversation and returns
     * the ids it closed.
     */
    public List<String> expireConversations() {
        List<String> closed = conversations.closeExpired(timeoutPolicy);
        for (String conversationId : closed) {
            emit(AuditEvent.of("conversation.close", SYSTEM_SENDER, conversationId, "timed_out", clock.millis(), Map.of()));
        }
        return closed;
    }

    public ConversationView purgeConversation(String conversationId) {
        ConversationView purged = conversations.purge(conversationId);
        emit(AuditEvent.of("conversation.purge", SYSTEM_SENDER, conversationId, "purged", clock.millis(), Map.of()));
        return purged;
    }

    public QueueStatus queueStatus(String agentId) {
        return requireMailbox(agentId).status();
    }

    public List<QueueStatus> queueStatuses() {
        List<QueueStatus> out = new ArrayList<>();
        for (String agentId : registeredAgents()) {
            Mailbox mailbox = mailboxes.get(agentId);
            if (mailbox != null) {
                out.add(mailbox.status());
            }
        }
        return out;
    }

    public List<String> registeredAgents() {
        List<String> ids = new ArrayList<>(mailboxes.keySet());
        ids.sort(String::compareTo);
        return ids;
    }

    /**
     * System-event broadcast. {@code targets == null} reaches every registered agent.
     */
    public DeliveryResult broadcastEvent(String sender, String eventType, String description, Priority priority,
                                         List<String> targets) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(OutboundMessage.SUBTYPE, STATUS_UPDATE);
        body.put("event_type", eventType == null ? "unknown" : eventType);
        body.put("description", description == null ? "" : description);
        String from = sender == null || sender.isBlank() ? SYSTEM_SENDER : sender;
        OutboundMessage draft = targets == null
                ? OutboundMessage.broadcastToAll(from, body)
                : OutboundMessage.broadcast(from, targets, body);
        return send(draft.withPriority(priority));
    }

    /**
     * Urgent system-event broadcast to every registered agent. The sender defaults
     * to the configured overseer, then to {@code system}.
     */
    public DeliveryResult broadcastEmergency(String sender, String description) {
        String from = sender == null || sender.isBlank()
                ? (overseerAgent == null ? SYSTEM_SENDER : overseerAgent)
                : sender;
        String text = description == null || description.isBlank() ? "Critical system event" : description;
        return broadcastEvent(from, EMERGENCY, "EMERGENCY: " + text, Priority.URGENT, null);
    }

    public DeliveryResult broadcastStatusUpdate(String agent, String status) {
        return broadcastEvent(agent, STATUS_UPDATE, "Status update: " + (status == null ? "unknown" : status),
                Priority.ROUTINE, null);
    }

    /**
     * Stops accepting sends. Mailbox contents stay in place so the owner can
     * persist them via {@link #snapshot()}.
     */
    public void shutdown() {
        if (shutDown.compareAndSet(false, true)) {
            int pending = 0;
            for (Mailbox mailbox : mailboxes.values()) {
                pending += mailbox.size();
            }
            log.info("Broker shut down with {} agent(s), {} pending envelope(s), {} conversation(s)",
                    mailboxes.size(), pending, conversations.size());
            emit(AuditEvent.of("broker.shutdown", SYSTEM_SENDER, "broker", "stopped", clock.millis(),
                    Map.of("pending_envelopes", pending)));
        }
    }

    public boolean isShutDown() {
        return shutDown.get();
    }

    public BrokerStats stats() {
        return new BrokerStats(
                mailboxes.size(),
                conversations.size(),
                conversations.activeCount(),
                taskRequests.size(),
                routedTotal.get(),
                deniedTotal.get(),
                malformedTotal.get(),
                droppedInviteTotal.get(),
                droppedNoticeTotal.get(),
                auditFailureTotal.get(),
                shutDown.get()
        );
    }

    public BrokerSnapshot snapshot() {
        List<BrokerSnapshot.MailboxState> states = new ArrayList<>();
        for (String agentId : registeredAgents()) {
            Mailbox mailbox = mailboxes.get(agentId);
            if (mailbox != null) {
                states.add(mailbox.snapshot());
            }
        }
        List<BrokerSnapshot.TaskRequestRecord> requests = new ArrayList<>(taskRequests.values());
        requests.sort((a, b) -> Long.compare(a.createdAtMs(), b.createdAtMs()));
        return new BrokerSnapshot(clock.millis(), states, conversations.list(), requests);
    }

    /**
     * Loads persisted state into a broker that has no agents and no conversations yet.
     */
    public void restore(BrokerSnapshot snapshot) {
        ensureOpen();
        if (!mailboxes.isEmpty() || conversations.size() > 0) {
            throw new IllegalStateException("restore requires an empty broker");
        }
        int envelopes = 0;
        for (BrokerSnapshot.MailboxState state : snapshot.mailboxes()) {
            mailboxes.put(state.agentId(), Mailbox.restore(state, clock));
            for (Envelope envelope : state.items()) {
                lastCreatedAtBySender.merge(envelope.sender(), envelope.createdAtMs(), Math::max);
                envelopes++;
            }
        }
        for (ConversationView conversation : snapshot.conversations()) {
            conversations.restore(conversation);
        }
        for (BrokerSnapshot.TaskRequestRecord request : snapshot.taskRequests()) {
            trackTaskRequest(request);
            lastCreatedAtBySender.merge(request.requester(), request.createdAtMs(), Math::max);
        }
        log.info("Restored {} mailbox(es) with {} envelope(s), {} conversation(s), {} task request(s)",
                snapshot.mailboxes().size(), envelopes, snapshot.conversations().size(), snapshot.taskRequests().size());
    }

    private void checkReferences(OutboundMessage draft) {
        if (draft.kind() == EnvelopeKind.TASK_RESPONSE) {
            BrokerSnapshot.TaskRequestRecord request = taskRequests.get(draft.requestId());
            if (request == null) {
                throw BrokerException.notFound("Originating task request not found: " + draft.requestId());
            }
            if (!request.requester().equals(draft.target())) {
                throw BrokerException.malformed("task_response: target " + draft.target()
                        + " is not the requester " + request.requester() + " of " + draft.requestId());
            }
        }
        if (draft.kind().directed() && !mailboxes.containsKey(draft.target())) {
            throw BrokerException.notFound("Agent not registered: " + draft.target());
        }
        if (draft.conversationId() != null) {
            conversations.requireActive(draft.conversationId());
        }
    }

    // Oldest requests fall out once the ledger is full; a late response to one fails with NOT_FOUND.
    private synchronized void trackTaskRequest(BrokerSnapshot.TaskRequestRecord request) {
        if (taskRequests.put(request.requestId(), request) == null) {
            taskRequestOrder.add(request.requestId());
        }
        while (taskRequests.size() > maxTaskRequests) {
            String oldest = taskRequestOrder.poll();
            if (oldest == null) {
                break;
            }
            taskRequests.remove(oldest);
        }
    }

    private Envelope admit(OutboundMessage draft) {
        long createdAtMs = lastCreatedAtBySender.merge(draft.sender(), clock.millis(),
                (previous, now) -> Math.max(previous + 1L, now));
        return Envelope.admit("env_" + UUID.randomUUID(), createdAtMs, draft);
    }

    private ValidationOutcome runValidator(Envelope envelope) {
        try {
            ValidationOutcome outcome = validator.validate(envelope);
            if (outcome == null) {
                return ValidationOutcome.deny(List.of("authority validator returned no outcome"));
            }
            return outcome;
        } catch (RuntimeException e) {
            log.warn("Authority validator failed for envelope {}", envelope.id(), e);
            return ValidationOutcome.deny(List.of("authority validator error: " + e.getMessage()));
        }
    }

    private List<String> resolveTargets(Envelope envelope) {
        if (envelope.kind().directed()) {
            return List.of(envelope.target());
        }
        if (envelope.broadcastTargets().allRegistered()) {
            return registeredAgents();
        }
        return new ArrayList<>(new LinkedHashSet<>(envelope.broadcastTargets().agents()));
    }

    private ConversationView recordConversationActivity(Envelope envelope) {
        try {
            return conversations.recordActivity(envelope.conversationId());
        } catch (BrokerException e) {
            log.warn("Conversation {} changed while envelope {} was in flight: {}",
                    envelope.conversationId(), envelope.id(), e.getMessage());
            return null;
        }
    }

    private boolean notifyOverseer(Envelope envelope, List<String> targets) {
        if (overseerAgent == null || overseerAgent.equals(envelope.sender()) || targets.contains(overseerAgent)) {
            return false;
        }
        Mailbox mailbox = mailboxes.get(overseerAgent);
        if (mailbox == null) {
            return false;
        }
        Map<String, Object> notice = new LinkedHashMap<>();
        notice.put(OutboundMessage.SUBTYPE, OVERSIGHT_NOTICE);
        notice.put("envelope_id", envelope.id());
        notice.put("envelope_kind", envelope.kind().wireName());
        notice.put("original_sender", envelope.sender());
        notice.put("targets", targets);
        Envelope copy = admit(OutboundMessage
                .agentMessage(SYSTEM_SENDER, overseerAgent, notice)
                .withPriority(envelope.priority())
                .inConversation(envelope.conversationId()));
        EnqueueResult enqueued = mailbox.enqueue(copy);
        if (!enqueued.accepted()) {
            droppedNoticeTotal.incrementAndGet();
            log.warn("Oversight notice for envelope {} dropped: overseer {} mailbox {}",
                    envelope.id(), overseerAgent, enqueued.reason());
        }
        return enqueued.accepted();
    }

    private Mailbox requireMailbox(String agentId) {
        Mailbox mailbox = agentId == null ? null : mailboxes.get(agentId);
        if (mailbox == null) {
            throw BrokerException.notFound("Agent not registered: " + agentId);
        }
        return mailbox;
    }

    private void emit(AuditEvent event) {
        try {
            auditSink.record(event);
        } catch (RuntimeException e) {
            auditFailureTotal.incrementAndGet();
            log.warn("Audit sink failed for {} on {}", event.action(), event.resource(), e);
        }
    }

    private void ensureOpen() {
        if (shutDown.get()) {
            throw new BrokerException(ErrorCode.BROKER_SHUT_DOWN, "Broker is shut down");
        }
    }
}
