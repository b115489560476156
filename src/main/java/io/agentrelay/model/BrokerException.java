package io.agentrelay.model;

/**
 * Precondition or input failure reported synchronously to the caller. The
 * broker never retries on its own.
 */
public final class BrokerException extends RuntimeException {
    private final ErrorCode code;

    public BrokerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    public static BrokerException malformed(String message) {
        return new BrokerException(ErrorCode.MALFORMED_ENVELOPE, message);
    }

    public static BrokerException notFound(String message) {
        return new BrokerException(ErrorCode.NOT_FOUND, message);
    }
}
