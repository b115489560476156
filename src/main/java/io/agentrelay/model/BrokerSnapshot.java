package io.agentrelay.model;

import java.util.List;

/**
 * Full in-memory broker state, in the shape the persistent store writes it.
 */
public record BrokerSnapshot(
        long takenAtMs,
        List<MailboxState> mailboxes,
        List<ConversationView> conversations,
        List<TaskRequestRecord> taskRequests
) {
    public BrokerSnapshot {
        mailboxes = mailboxes == null ? List.of() : List.copyOf(mailboxes);
        conversations = conversations == null ? List.of() : List.copyOf(conversations);
        taskRequests = taskRequests == null ? List.of() : List.copyOf(taskRequests);
    }

    /** Items are listed in dequeue order. */
    public record MailboxState(
            String agentId,
            int capacity,
            List<Envelope> items,
            long enqueuedCount,
            long deliveredCount,
            long rejectedCount,
            long expiredCount
    ) {
        public MailboxState {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    public record TaskRequestRecord(String requestId, String requester, String target, long createdAtMs) {
    }
}
