package com.aporkolab.retry.core.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * {@code delay = attemptCount * step}. With the default one-minute step and five
 * attempts the total added delay stays around fifteen minutes, so no cap or jitter.
 */
public class LinearBackoffPolicy implements BackoffPolicy {

    public static final Duration DEFAULT_STEP = Duration.ofSeconds(60);

    private final Duration step;

    public LinearBackoffPolicy() {
        this(DEFAULT_STEP);
    }

    public LinearBackoffPolicy(Duration step) {
        Objects.requireNonNull(step, "step must not be null");
        if (step.isNegative() || step.isZero()) {
            throw new IllegalArgumentException("step must be positive, was " + step);
        }
        this.step = step;
    }

    @Override
    public Duration delayFor(int attemptCount) {
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be >= 1, was " + attemptCount);
        }
        return step.multipliedBy(attemptCount);
    }

    public Duration getStep() {
        return step;
    }

    @Override
    public String toString() {
        return "LinearBackoffPolicy{step=" + step + "}";
    }
}
