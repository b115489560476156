package io.agentrelay.conversation;

import io.agentrelay.model.ConversationView;

/**
 * Owner-supplied hook deciding when an active conversation should be closed.
 * Evaluated only when the owner asks the broker to expire conversations.
 */
@FunctionalInterface
public interface ConversationTimeoutPolicy {
    boolean shouldClose(ConversationView conversation, long nowMs);

    static ConversationTimeoutPolicy never() {
        return (conversation, nowMs) -> false;
    }
}
