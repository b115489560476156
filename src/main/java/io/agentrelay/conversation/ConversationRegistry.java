package io.agentrelay.conversation;

import io.agentrelay.model.BrokerException;
import io.agentrelay.model.ConversationView;
import io.agentrelay.model.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks multi-party conversations. Lookups are lock-free; writes to one
 * conversation are serialized on that conversation only.
 */
public final class ConversationRegistry {
    public static final String DEFAULT_KIND = "ad_hoc";
    private static final Logger log = LoggerFactory.getLogger(ConversationRegistry.class);

    private final ConcurrentMap<String, Conversation> conversations;
    private final OversightPolicy oversightPolicy;
    private final Clock clock;

    public ConversationRegistry() {
        this(OversightPolicy.defaults(), Clock.systemUTC());
    }

    public ConversationRegistry(OversightPolicy oversightPolicy, Clock clock) {
        this.conversations = new ConcurrentHashMap<>();
        this.oversightPolicy = oversightPolicy == null ? OversightPolicy.defaults() : oversightPolicy;
        this.clock = clock;
    }

    public ConversationView create(String kind, List<String> participants, String initiator, String topic) {
        if (participants == null || participants.isEmpty()) {
            throw new BrokerException(ErrorCode.INVALID_PARTICIPANTS, "Conversation needs at least one participant");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String participant : participants) {
            if (participant == null || participant.isBlank()) {
                throw new BrokerException(ErrorCode.INVALID_PARTICIPANTS, "Participant id cannot be empty");
            }
            unique.add(participant.trim());
        }
        if (initiator == null || !unique.contains(initiator.trim())) {
            throw new BrokerException(
                    ErrorCode.INVALID_PARTICIPANTS,
                    "Initiator " + initiator + " is not a participant of the conversation"
            );
        }
        String resolvedKind = kind == null || kind.isBlank() ? DEFAULT_KIND : kind.trim();
        Conversation conversation = new Conversation(
                "conv_" + UUID.randomUUID(),
                resolvedKind,
                topic,
                new ArrayList<>(unique),
                initiator.trim(),
                oversightPolicy.requiresOversight(resolvedKind),
                clock.millis()
        );
        conversations.put(conversation.id(), conversation);
        ConversationView view = conversation.view();
        log.info("Conversation {} started kind={} participants={} oversight={}",
                view.id(), view.kind(), view.participants().size(), view.oversightRequired());
        return view;
    }

    /**
     * Adding an agent that already participates is a no-op.
     */
    public ConversationView addParticipant(String conversationId, String agent) {
        if (agent == null || agent.isBlank()) {
            throw new BrokerException(ErrorCode.INVALID_PARTICIPANTS, "Participant id cannot be empty");
        }
        Conversation conversation = lookup(conversationId);
        conversation.addParticipant(agent.trim());
        return conversation.view();
    }

    public ConversationView recordActivity(String conversationId) {
        return lookup(conversationId).recordActivity(clock.millis());
    }

    public ConversationView close(String conversationId) {
        Conversation conversation = lookup(conversationId);
        if (conversation.close(clock.millis())) {
            log.info("Conversation {} closed", conversationId);
        }
        return conversation.view();
    }

    public Optional<ConversationView> get(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        Conversation conversation = conversations.get(conversationId);
        return conversation == null ? Optional.empty() : Optional.of(conversation.view());
    }

    /**
     * Fails with {@code NOT_FOUND} for unknown ids and {@code CONVERSATION_CLOSED}
     * for closed ones.
     */
    public ConversationView requireActive(String conversationId) {
        ConversationView view = lookup(conversationId).view();
        if (!view.active()) {
            throw new BrokerException(ErrorCode.CONVERSATION_CLOSED, "Conversation is closed: " + conversationId);
        }
        return view;
    }

    /**
     * Removes a closed conversation for good. Active conversations must be closed first.
     */
    public ConversationView purge(String conversationId) {
        Conversation conversation = lookup(conversationId);
        if (conversation.isActive()) {
            throw new BrokerException(
                    ErrorCode.CONVERSATION_ACTIVE,
                    "Conversation must be closed before purge: " + conversationId
            );
        }
        conversations.remove(conversationId, conversation);
        return conversation.view();
    }

    public List<String> closeExpired(ConversationTimeoutPolicy policy) {
        long nowMs = clock.millis();
        List<String> closed = new ArrayList<>();
        for (Conversation conversation : conversations.values()) {
            ConversationView view = conversation.view();
            if (view.active() && policy.shouldClose(view, nowMs) && conversation.close(nowMs)) {
                closed.add(view.id());
            }
        }
        if (!closed.isEmpty()) {
            log.info("Timed out {} conversation(s): {}", closed.size(), closed);
        }
        return closed;
    }

    public List<ConversationView> list() {
        List<ConversationView> out = new ArrayList<>();
        for (Conversation conversation : conversations.values()) {
            out.add(conversation.view());
        }
        out.sort(Comparator.comparingLong(ConversationView::createdAtMs).thenComparing(ConversationView::id));
        return out;
    }

    public int activeCount() {
        int count = 0;
        for (Conversation conversation : conversations.values()) {
            if (conversation.isActive()) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return conversations.size();
    }

    public void restore(ConversationView view) {
        conversations.put(view.id(), Conversation.fromView(view));
    }

    private Conversation lookup(String conversationId) {
        Conversation conversation = conversationId == null ? null : conversations.get(conversationId);
        if (conversation == null) {
            throw BrokerException.notFound("Conversation not found: " + conversationId);
        }
        return conversation;
    }
}
