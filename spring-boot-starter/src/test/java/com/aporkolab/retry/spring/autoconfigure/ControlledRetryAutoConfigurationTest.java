package com.aporkolab.retry.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.kafka.core.KafkaTemplate;

import com.aporkolab.retry.core.RetryController;
import com.aporkolab.retry.core.RetrySettings;
import com.aporkolab.retry.core.policy.AttemptLimiter;
import com.aporkolab.retry.core.policy.BackoffPolicy;
import com.aporkolab.retry.core.schedule.DelayedDeliveryPort;
import com.aporkolab.retry.core.schedule.ScheduleHandle;
import com.aporkolab.retry.core.sink.DeadLetterPort;
import com.aporkolab.retry.kafka.FailedMessageListener;
import com.aporkolab.retry.kafka.KafkaDeadLetterPort;
import com.aporkolab.retry.metrics.RetryMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ControlledRetryAutoConfigurationTest {

    private static final DelayedDeliveryPort IN_MEMORY_PORT =
            request -> new ScheduleHandle(request.name(), request.target(), request.fireAt());

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ControlledRetryAutoConfiguration.class))
            .withBean(DelayedDeliveryPort.class, () -> IN_MEMORY_PORT)
            .withPropertyValues(
                    "controlled-retry.scheduler.enabled=false",
                    "controlled-retry.retry-target=source-queue",
                    "controlled-retry.execution-role=scheduler-role",
                    "controlled-retry.dead-letter.destination=final-dlq");

    @Nested
    @DisplayName("With Kafka available")
    class WithKafka {

        @Test
        @DisplayName("should wire the controller, dead-letter port and listener")
        @SuppressWarnings("unchecked")
        void shouldWireEverything() {
            contextRunner
                    .withBean(KafkaTemplate.class, () -> mock(KafkaTemplate.class))
                    .run(context -> {
                        assertThat(context).hasNotFailed();
                        assertThat(context).hasSingleBean(RetryController.class);
                        assertThat(context).hasSingleBean(KafkaDeadLetterPort.class);
                        assertThat(context).hasSingleBean(FailedMessageListener.class);
                        assertThat(context).hasSingleBean(Clock.class);
                        assertThat(context).doesNotHaveBean(RetryMetrics.class);
                    });
        }

        @Test
        @DisplayName("should apply defaults for attempts and backoff")
        @SuppressWarnings("unchecked")
        void shouldApplyDefaults() {
            contextRunner
                    .withBean(KafkaTemplate.class, () -> mock(KafkaTemplate.class))
                    .run(context -> {
                        assertThat(context.getBean(AttemptLimiter.class).getMaxAttempts()).isEqualTo(5);
                        assertThat(context.getBean(BackoffPolicy.class).delayFor(2)).isEqualTo(Duration.ofSeconds(120));
                        RetrySettings settings = context.getBean(RetrySettings.class);
                        assertThat(settings.getMaxDetailLength()).isEqualTo(2000);
                        assertThat(settings.getRetryTarget()).isEqualTo("source-queue");
                    });
        }

        @Test
        @DisplayName("should bind overridden values")
        @SuppressWarnings("unchecked")
        void shouldBindOverrides() {
            contextRunner
                    .withBean(KafkaTemplate.class, () -> mock(KafkaTemplate.class))
                    .withPropertyValues(
                            "controlled-retry.max-attempts=3",
                            "controlled-retry.backoff-step=30s")
                    .run(context -> {
                        assertThat(context.getBean(RetryController.class).getMaxAttempts()).isEqualTo(3);
                        assertThat(context.getBean(BackoffPolicy.class).delayFor(2)).isEqualTo(Duration.ofSeconds(60));
                    });
        }

        @Test
        @DisplayName("should not register the listener when disabled")
        @SuppressWarnings("unchecked")
        void shouldSkipListenerWhenDisabled() {
            contextRunner
                    .withBean(KafkaTemplate.class, () -> mock(KafkaTemplate.class))
                    .withPropertyValues("controlled-retry.listener.enabled=false")
                    .run(context -> assertThat(context).doesNotHaveBean(FailedMessageListener.class));
        }

        @Test
        @DisplayName("should register metrics as a retry listener when a registry exists")
        @SuppressWarnings("unchecked")
        void shouldRegisterMetrics() {
            contextRunner
                    .withBean(KafkaTemplate.class, () -> mock(KafkaTemplate.class))
                    .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                    .run(context -> assertThat(context).hasSingleBean(RetryMetrics.class));
        }

        @Test
        @DisplayName("should keep a user supplied clock")
        @SuppressWarnings("unchecked")
        void shouldKeepUserClock() {
            Clock fixed = Clock.fixed(Instant.parse("2026-10-19T10:00:00Z"), ZoneOffset.UTC);
            contextRunner
                    .withBean(KafkaTemplate.class, () -> mock(KafkaTemplate.class))
                    .withBean(Clock.class, () -> fixed)
                    .run(context -> assertThat(context.getBean(Clock.class)).isSameAs(fixed));
        }
    }

    @Nested
    @DisplayName("Startup validation")
    class StartupValidation {

        @Test
        @DisplayName("should fail when the dead-letter destination is missing")
        void shouldFailWithoutDestination() {
            new ApplicationContextRunner()
                    .withConfiguration(AutoConfigurations.of(ControlledRetryAutoConfiguration.class))
                    .withBean(DelayedDeliveryPort.class, () -> IN_MEMORY_PORT)
                    .withBean(DeadLetterPort.class, () -> deadLetter -> { })
                    .withPropertyValues(
                            "controlled-retry.scheduler.enabled=false",
                            "controlled-retry.retry-target=source-queue",
                            "controlled-retry.execution-role=scheduler-role")
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("should fail when max attempts is below one")
        void shouldFailWithInvalidMaxAttempts() {
            contextRunner
                    .withBean(DeadLetterPort.class, () -> deadLetter -> { })
                    .withPropertyValues("controlled-retry.max-attempts=0")
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("should back off entirely when disabled")
        void shouldBackOffWhenDisabled() {
            contextRunner
                    .withPropertyValues("controlled-retry.enabled=false")
                    .run(context -> assertThat(context).doesNotHaveBean(RetryController.class));
        }
    }
}
