package io.agentrelay.conversation;

import io.agentrelay.model.ConversationView;

public final class IdleTimeoutPolicy implements ConversationTimeoutPolicy {
    private final long idleMs;

    public IdleTimeoutPolicy(long idleMs) {
        if (idleMs <= 0L) {
            throw new IllegalArgumentException("idle timeout must be positive: " + idleMs);
        }
        this.idleMs = idleMs;
    }

    public long idleMs() {
        return idleMs;
    }

    @Override
    public boolean shouldClose(ConversationView conversation, long nowMs) {
        return conversation.active() && nowMs - conversation.lastActivityAtMs() >= idleMs;
    }
}
