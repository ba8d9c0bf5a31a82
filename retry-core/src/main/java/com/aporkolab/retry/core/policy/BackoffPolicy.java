package com.aporkolab.retry.core.policy;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Maps an attempt count to the delay before the next delivery.
 */
public interface BackoffPolicy {

    /**
     * @param attemptCount 1-based attempt count (the retry count after increment)
     */
    Duration delayFor(int attemptCount);

    /**
     * Absolute fire time for the given attempt, truncated to whole seconds
     * (the delayed-delivery service has no sub-second granularity).
     */
    default Instant nextFireTime(Instant now, int attemptCount) {
        return now.plus(delayFor(attemptCount)).truncatedTo(ChronoUnit.SECONDS);
    }
}
