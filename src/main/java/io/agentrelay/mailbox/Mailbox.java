package io.agentrelay.mailbox;

import io.agentrelay.model.BrokerSnapshot;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.QueueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded inbound queue owned by a single agent. Highest priority leaves first,
 * FIFO within a priority level. Enqueue never blocks: a full mailbox rejects.
 *
 * <p>Every method takes the mailbox's own monitor; there is no lock shared with
 * other mailboxes.
 */
public final class Mailbox {
    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);
    private static final Comparator<Slot> DEQUEUE_ORDER = Comparator
            .comparingInt((Slot slot) -> -slot.envelope().priority().rank())
            .thenComparingLong(Slot::sequence);

    private final String owner;
    private final int capacity;
    private final Clock clock;
    private final PriorityQueue<Slot> items;
    private final AtomicLong enqueuedCount;
    private final AtomicLong deliveredCount;
    private final AtomicLong rejectedCount;
    private final AtomicLong expiredCount;
    private long nextSequence;

    public Mailbox(String owner, int capacity) {
        this(owner, capacity, Clock.systemUTC());
    }

    public Mailbox(String owner, int capacity, Clock clock) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("mailbox owner cannot be empty");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("mailbox capacity must be positive: " + capacity);
        }
        this.owner = owner;
        this.capacity = capacity;
        this.clock = clock;
        this.items = new PriorityQueue<>(Math.min(capacity, 64), DEQUEUE_ORDER);
        this.enqueuedCount = new AtomicLong(0L);
        this.deliveredCount = new AtomicLong(0L);
        this.rejectedCount = new AtomicLong(0L);
        this.expiredCount = new AtomicLong(0L);
        this.nextSequence = 0L;
    }

    public String owner() {
        return owner;
    }

    public int capacity() {
        return capacity;
    }

    public synchronized EnqueueResult enqueue(Envelope envelope) {
        if (items.size() >= capacity) {
            rejectedCount.incrementAndGet();
            return EnqueueResult.rejected(items.size());
        }
        items.add(new Slot(envelope, nextSequence++));
        enqueuedCount.incrementAndGet();
        return EnqueueResult.accepted(items.size());
    }

    /**
     * Pops the next live envelope. Expired envelopes met on the way are discarded
     * and counted as expired.
     */
    public synchronized Optional<Envelope> dequeue() {
        long nowMs = clock.millis();
        while (!items.isEmpty()) {
            Envelope head = items.poll().envelope();
            if (head.isExpired(nowMs)) {
                expiredCount.incrementAndGet();
                log.debug("Discarded expired envelope {} from mailbox {}", head.id(), owner);
                continue;
            }
            deliveredCount.incrementAndGet();
            return Optional.of(head);
        }
        return Optional.empty();
    }

    public synchronized Optional<Envelope> peek() {
        Slot head = items.peek();
        return head == null ? Optional.empty() : Optional.of(head.envelope());
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized boolean isFull() {
        return items.size() >= capacity;
    }

    public synchronized QueueStatus status() {
        return new QueueStatus(
                owner,
                items.size(),
                capacity,
                enqueuedCount.get(),
                deliveredCount.get(),
                rejectedCount.get(),
                expiredCount.get()
        );
    }

    public synchronized BrokerSnapshot.MailboxState snapshot() {
        List<Slot> ordered = new ArrayList<>(items);
        ordered.sort(DEQUEUE_ORDER);
        List<Envelope> envelopes = new ArrayList<>(ordered.size());
        for (Slot slot : ordered) {
            envelopes.add(slot.envelope());
        }
        return new BrokerSnapshot.MailboxState(
                owner,
                capacity,
                envelopes,
                enqueuedCount.get(),
                deliveredCount.get(),
                rejectedCount.get(),
                expiredCount.get()
        );
    }

    /**
     * Rebuilds a mailbox from persisted state. Items beyond capacity are dropped
     * and counted as rejected.
     */
    public static Mailbox restore(BrokerSnapshot.MailboxState state, Clock clock) {
        Mailbox mailbox = new Mailbox(state.agentId(), state.capacity(), clock);
        for (Envelope envelope : state.items()) {
            if (!mailbox.enqueue(envelope).accepted()) {
                log.warn("Mailbox {} restore overflow, dropping envelope {}", state.agentId(), envelope.id());
            }
        }
        mailbox.enqueuedCount.set(Math.max(state.enqueuedCount(), mailbox.enqueuedCount.get()));
        mailbox.deliveredCount.set(state.deliveredCount());
        mailbox.rejectedCount.addAndGet(state.rejectedCount());
        mailbox.expiredCount.set(state.expiredCount());
        return mailbox;
    }

    private record Slot(Envelope envelope, long sequence) {
    }
}
