package com.aporkolab.retry.core.policy;

/**
 * Decides whether a message still has retry budget.
 * 
 * The count is checked after increment, so a message gets exactly
 * {@code maxAttempts} retries after its first failure: a count equal to the
 * maximum still continues, the following failure is exhausted.
 */
public class AttemptLimiter {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final int maxAttempts;

    public AttemptLimiter() {
        this(DEFAULT_MAX_ATTEMPTS);
    }

    public AttemptLimiter(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    public AttemptVerdict classify(int retryCount) {
        return classify(retryCount, maxAttempts);
    }

    public static AttemptVerdict classify(int retryCount, int maxAttempts) {
        return retryCount > maxAttempts ? AttemptVerdict.EXHAUSTED : AttemptVerdict.CONTINUE;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
