package io.agentrelay.observability;

/**
 * Append-only recipient of routing events. The broker treats a failing sink as
 * a logging concern only; it never changes a send outcome.
 */
@FunctionalInterface
public interface AuditSink {
    void record(AuditEvent event);

    static AuditSink discarding() {
        return event -> {
        };
    }
}
