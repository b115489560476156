package io.agentrelay.model;

public record QueueStatus(
        String agentId,
        int size,
        int capacity,
        long enqueuedCount,
        long deliveredCount,
        long rejectedCount,
        long expiredCount
) {
    public double capacityUsed() {
        return capacity == 0 ? 0.0 : (double) size / capacity;
    }

    public boolean full() {
        return size >= capacity;
    }
}
