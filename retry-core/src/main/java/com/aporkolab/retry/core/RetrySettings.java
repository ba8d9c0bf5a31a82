package com.aporkolab.retry.core;

import java.time.Duration;

import com.aporkolab.retry.core.policy.AttemptLimiter;
import com.aporkolab.retry.core.policy.LinearBackoffPolicy;

/**
 * Startup configuration of the retry core. Built once, never mutated.
 * Missing destinations fail {@link Builder#build()}, not the first message.
 */
public final class RetrySettings {

    public static final int DEFAULT_MAX_DETAIL_LENGTH = 2000;

    private final String deadLetterDestination;
    private final String retryTarget;
    private final String executionRole;
    private final int maxAttempts;
    private final Duration backoffStep;
    private final int maxDetailLength;

    private RetrySettings(Builder builder) {
        this.deadLetterDestination = builder.deadLetterDestination;
        this.retryTarget = builder.retryTarget;
        this.executionRole = builder.executionRole;
        this.maxAttempts = builder.maxAttempts;
        this.backoffStep = builder.backoffStep;
        this.maxDetailLength = builder.maxDetailLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDeadLetterDestination() { return deadLetterDestination; }
    public String getRetryTarget() { return retryTarget; }
    public String getExecutionRole() { return executionRole; }
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBackoffStep() { return backoffStep; }
    public int getMaxDetailLength() { return maxDetailLength; }

    @Override
    public String toString() {
        return "RetrySettings{deadLetterDestination=" + deadLetterDestination
                + ", retryTarget=" + retryTarget
                + ", executionRole=" + executionRole
                + ", maxAttempts=" + maxAttempts
                + ", backoffStep=" + backoffStep
                + ", maxDetailLength=" + maxDetailLength + "}";
    }

    public static class Builder {
        private String deadLetterDestination;
        private String retryTarget;
        private String executionRole;
        private int maxAttempts = AttemptLimiter.DEFAULT_MAX_ATTEMPTS;
        private Duration backoffStep = LinearBackoffPolicy.DEFAULT_STEP;
        private int maxDetailLength = DEFAULT_MAX_DETAIL_LENGTH;

        public Builder deadLetterDestination(String deadLetterDestination) {
            this.deadLetterDestination = deadLetterDestination;
            return this;
        }

        public Builder retryTarget(String retryTarget) {
            this.retryTarget = retryTarget;
            return this;
        }

        public Builder executionRole(String executionRole) {
            this.executionRole = executionRole;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffStep(Duration backoffStep) {
            if (backoffStep == null || backoffStep.isNegative() || backoffStep.isZero()) {
                throw new IllegalArgumentException("backoffStep must be positive");
            }
            this.backoffStep = backoffStep;
            return this;
        }

        public Builder maxDetailLength(int maxDetailLength) {
            if (maxDetailLength < 32) {
                throw new IllegalArgumentException("maxDetailLength must be >= 32");
            }
            this.maxDetailLength = maxDetailLength;
            return this;
        }

        public RetrySettings build() {
            requireText(deadLetterDestination, "deadLetterDestination");
            requireText(retryTarget, "retryTarget");
            requireText(executionRole, "executionRole");
            return new RetrySettings(this);
        }

        private static void requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalStateException(name + " must be configured");
            }
        }
    }
}
