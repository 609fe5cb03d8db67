package com.flagship.budget_reconciliation.sync;

import lombok.Getter;

/**
 * Failure reported by a downstream synchronization collaborator.
 * {@code retryable} marks transient causes: rate limiting, connection errors, timeouts.
 */
@Getter
public class DownstreamSyncException extends RuntimeException {

    private final boolean retryable;

    public DownstreamSyncException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public DownstreamSyncException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static DownstreamSyncException rateLimited(String target) {
        return new DownstreamSyncException(target + " rate limit reached", true);
    }

    public static DownstreamSyncException connectionFailed(String target, Throwable cause) {
        return new DownstreamSyncException(target + " connection failed: " + cause.getMessage(), true, cause);
    }

    public static DownstreamSyncException rejected(String target, String reason) {
        return new DownstreamSyncException(target + " rejected the record: " + reason, false);
    }
}
