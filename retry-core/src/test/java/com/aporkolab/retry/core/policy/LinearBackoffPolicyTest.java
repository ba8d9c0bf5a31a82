package com.aporkolab.retry.core.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LinearBackoffPolicyTest {

    private final LinearBackoffPolicy policy = new LinearBackoffPolicy();

    @Test
    @DisplayName("should delay sixty seconds per attempt by default")
    void shouldDelaySixtySecondsPerAttempt() {
        for (int n = 1; n <= 10; n++) {
            assertThat(policy.delayFor(n)).isEqualTo(Duration.ofSeconds(60L * n));
        }
    }

    @Test
    @DisplayName("should be strictly increasing")
    void shouldBeStrictlyIncreasing() {
        for (int n = 1; n < 20; n++) {
            assertThat(policy.delayFor(n + 1)).isGreaterThan(policy.delayFor(n));
        }
    }

    @Test
    @DisplayName("should support a custom step")
    void shouldSupportCustomStep() {
        LinearBackoffPolicy fast = new LinearBackoffPolicy(Duration.ofSeconds(5));

        assertThat(fast.delayFor(3)).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    @DisplayName("should add delay to now and truncate sub-seconds")
    void shouldComputeNextFireTime() {
        Instant now = Instant.parse("2026-10-19T10:00:00.750Z");

        assertThat(policy.nextFireTime(now, 1)).isEqualTo(Instant.parse("2026-10-19T10:01:00Z"));
        assertThat(policy.nextFireTime(now, 5)).isEqualTo(Instant.parse("2026-10-19T10:05:00Z"));
    }

    @Test
    @DisplayName("should reject attempt counts below one")
    void shouldRejectNonPositiveAttempt() {
        assertThatThrownBy(() -> policy.delayFor(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject non-positive steps")
    void shouldRejectNonPositiveStep() {
        assertThatThrownBy(() -> new LinearBackoffPolicy(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LinearBackoffPolicy(Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
