package io.agentrelay.conversation;

import io.agentrelay.model.BrokerException;
import io.agentrelay.model.ConversationStatus;
import io.agentrelay.model.ConversationView;
import io.agentrelay.model.ErrorCode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable session state. Each instance is its own lock, so activity on one
 * conversation never waits on another.
 */
final class Conversation {
    private final String id;
    private final String kind;
    private final String topic;
    private final String initiator;
    private final boolean oversightRequired;
    private final long createdAtMs;
    private final Set<String> participants;
    private ConversationStatus status;
    private long messageCount;
    private long lastActivityAtMs;
    private Long closedAtMs;

    Conversation(
            String id,
            String kind,
            String topic,
            List<String> participants,
            String initiator,
            boolean oversightRequired,
            long createdAtMs
    ) {
        this.id = id;
        this.kind = kind;
        this.topic = topic;
        this.initiator = initiator;
        this.oversightRequired = oversightRequired;
        this.createdAtMs = createdAtMs;
        this.participants = new LinkedHashSet<>(participants);
        this.status = ConversationStatus.ACTIVE;
        this.messageCount = 0L;
        this.lastActivityAtMs = createdAtMs;
        this.closedAtMs = null;
    }

    static Conversation fromView(ConversationView view) {
        Conversation conversation = new Conversation(
                view.id(),
                view.kind(),
                view.topic(),
                view.participants(),
                view.initiator(),
                view.oversightRequired(),
                view.createdAtMs()
        );
        conversation.status = view.status() == null ? ConversationStatus.ACTIVE : view.status();
        conversation.messageCount = view.messageCount();
        conversation.lastActivityAtMs = view.lastActivityAtMs();
        conversation.closedAtMs = view.closedAtMs();
        return conversation;
    }

    String id() {
        return id;
    }

    synchronized boolean addParticipant(String agent) {
        ensureActive();
        return participants.add(agent);
    }

    synchronized ConversationView recordActivity(long nowMs) {
        ensureActive();
        messageCount++;
        lastActivityAtMs = Math.max(lastActivityAtMs, nowMs);
        return view();
    }

    synchronized boolean close(long nowMs) {
        if (status == ConversationStatus.CLOSED) {
            return false;
        }
        status = ConversationStatus.CLOSED;
        closedAtMs = nowMs;
        return true;
    }

    synchronized boolean isActive() {
        return status == ConversationStatus.ACTIVE;
    }

    synchronized ConversationView view() {
        return new ConversationView(
                id,
                kind,
                topic,
                new ArrayList<>(participants),
                initiator,
                status,
                oversightRequired,
                messageCount,
                createdAtMs,
                lastActivityAtMs,
                closedAtMs
        );
    }

    private void ensureActive() {
        if (status != ConversationStatus.ACTIVE) {
            throw new BrokerException(ErrorCode.CONVERSATION_CLOSED, "Conversation is closed: " + id);
        }
    }
}
