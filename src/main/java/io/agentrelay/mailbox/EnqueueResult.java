package io.agentrelay.mailbox;

public record EnqueueResult(boolean accepted, String reason, int sizeAfter) {
    public static final String CAPACITY_EXCEEDED = "capacity_exceeded";

    static EnqueueResult accepted(int sizeAfter) {
        return new EnqueueResult(true, null, sizeAfter);
    }

    static EnqueueResult rejected(int size) {
        return new EnqueueResult(false, CAPACITY_EXCEEDED, size);
    }
}
