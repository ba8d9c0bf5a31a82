package com.aporkolab.retry.core.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AttemptLimiterTest {

    @Test
    @DisplayName("should continue for every count up to the maximum")
    void shouldContinueUpToMax() {
        AttemptLimiter limiter = new AttemptLimiter(5);

        for (int count = 1; count <= 5; count++) {
            assertThat(limiter.classify(count)).isEqualTo(AttemptVerdict.CONTINUE);
        }
    }

    @Test
    @DisplayName("should be exhausted strictly above the maximum")
    void shouldExhaustAboveMax() {
        assertThat(AttemptLimiter.classify(6, 5)).isEqualTo(AttemptVerdict.EXHAUSTED);
        assertThat(AttemptLimiter.classify(5, 5)).isEqualTo(AttemptVerdict.CONTINUE);
        assertThat(AttemptLimiter.classify(2, 1)).isEqualTo(AttemptVerdict.EXHAUSTED);
    }

    @Test
    @DisplayName("should return the same verdict for the same input")
    void shouldBeIdempotent() {
        AttemptLimiter limiter = new AttemptLimiter(3);

        for (int i = 0; i < 10; i++) {
            assertThat(limiter.classify(3)).isEqualTo(AttemptVerdict.CONTINUE);
            assertThat(limiter.classify(4)).isEqualTo(AttemptVerdict.EXHAUSTED);
        }
    }

    @Test
    @DisplayName("should default to five attempts")
    void shouldDefaultToFive() {
        assertThat(new AttemptLimiter().getMaxAttempts()).isEqualTo(5);
    }

    @Test
    @DisplayName("should reject a maximum below one")
    void shouldRejectInvalidMax() {
        assertThatThrownBy(() -> new AttemptLimiter(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
