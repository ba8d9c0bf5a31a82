package com.aporkolab.retry.core.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Retry bookkeeping carried inside every message.
 *
 * @param messageId     opaque identifier, validated upstream
 * @param retryCount    number of passes through the retry controller, never negative
 * @param nextRetryTime when the pending retry fires, or {@code null} before the first schedule
 */
public record RetryMetadata(String messageId, int retryCount, Instant nextRetryTime) {

    public RetryMetadata {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, was " + retryCount);
        }
        if (nextRetryTime != null) {
            nextRetryTime = nextRetryTime.truncatedTo(ChronoUnit.SECONDS);
        }
    }

    public static RetryMetadata firstFailure(String messageId) {
        return new RetryMetadata(messageId, 0, null);
    }

    /**
     * Returns a copy with the retry count increased by exactly one.
     * The next retry time is left as it was.
     *
     * @throws ArithmeticException if the count is already {@link Integer#MAX_VALUE}
     */
    public RetryMetadata increment() {
        return new RetryMetadata(messageId, Math.addExact(retryCount, 1), nextRetryTime);
    }

    public RetryMetadata withNextRetryTime(Instant nextRetryTime) {
        return new RetryMetadata(messageId, retryCount, nextRetryTime);
    }

    public boolean hasPendingRetry() {
        return nextRetryTime != null;
    }
}
