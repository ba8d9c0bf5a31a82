package com.aporkolab.retry.spring.autoconfigure;

import java.time.Clock;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.aporkolab.retry.core.RetryController;
import com.aporkolab.retry.core.RetryListener;
import com.aporkolab.retry.core.RetrySettings;
import com.aporkolab.retry.core.model.RetryMessageCodec;
import com.aporkolab.retry.core.policy.AttemptLimiter;
import com.aporkolab.retry.core.policy.BackoffPolicy;
import com.aporkolab.retry.core.policy.LinearBackoffPolicy;
import com.aporkolab.retry.core.schedule.DelayedDeliveryPort;
import com.aporkolab.retry.core.schedule.RetryScheduler;
import com.aporkolab.retry.core.sink.DeadLetterPort;
import com.aporkolab.retry.core.sink.DeadLetterSink;
import com.aporkolab.retry.kafka.FailedMessageListener;
import com.aporkolab.retry.kafka.KafkaDeadLetterPort;
import com.aporkolab.retry.metrics.RetryMetrics;
import com.aporkolab.retry.scheduler.ExecutionRoleGrants;
import com.aporkolab.retry.scheduler.JpaDelayedDeliveryPort;
import com.aporkolab.retry.scheduler.ScheduledRetry;
import com.aporkolab.retry.scheduler.ScheduledRetryDispatcher;
import com.aporkolab.retry.scheduler.ScheduledRetryRepository;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Spring Boot Auto-Configuration for controlled retry.
 * 
 * Automatically configures:
 * - Retry controller with backoff, attempt limit and dead-letter sink
 * - Kafka dead-letter port and failed-message listener
 * - JPA-backed delayed delivery with its polling dispatcher
 * - Micrometer metrics when a MeterRegistry is present
 * 
 * Disable with: controlled-retry.enabled=false
 */
@AutoConfiguration(
        after = {JacksonAutoConfiguration.class, KafkaAutoConfiguration.class, HibernateJpaAutoConfiguration.class},
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(ControlledRetryProperties.class)
@ConditionalOnProperty(prefix = "controlled-retry", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ControlledRetryAutoConfiguration {

    // ==================== CORE ====================

    @Bean
    @ConditionalOnMissingBean
    public Clock retryClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrySettings retrySettings(ControlledRetryProperties properties) {
        return RetrySettings.builder()
                .maxAttempts(properties.getMaxAttempts())
                .backoffStep(properties.getBackoffStep())
                .retryTarget(properties.getRetryTarget())
                .executionRole(properties.getExecutionRole())
                .deadLetterDestination(properties.getDeadLetter().getDestination())
                .maxDetailLength(properties.getDeadLetter().getMaxDetailLength())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMessageCodec retryMessageCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new RetryMessageCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public AttemptLimiter attemptLimiter(RetrySettings settings) {
        return new AttemptLimiter(settings.getMaxAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy backoffPolicy(RetrySettings settings) {
        return new LinearBackoffPolicy(settings.getBackoffStep());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryScheduler retryScheduler(DelayedDeliveryPort deliveryPort, RetryMessageCodec codec,
                                         RetrySettings settings) {
        return new RetryScheduler(deliveryPort, codec, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterSink deadLetterSink(DeadLetterPort deadLetterPort, RetrySettings settings) {
        return new DeadLetterSink(deadLetterPort, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryController retryController(RetryMessageCodec codec,
                                           AttemptLimiter attemptLimiter,
                                           BackoffPolicy backoffPolicy,
                                           RetryScheduler retryScheduler,
                                           DeadLetterSink deadLetterSink,
                                           Clock retryClock,
                                           ObjectProvider<RetryListener> listeners) {
        return new RetryController(codec, attemptLimiter, backoffPolicy, retryScheduler, deadLetterSink,
                retryClock, listeners.orderedStream().toList());
    }

    // ==================== KAFKA ====================

    @Configuration
    @ConditionalOnClass(KafkaTemplate.class)
    @ConditionalOnBean(KafkaTemplate.class)
    static class KafkaAdapterConfiguration {

        @Bean
        @ConditionalOnMissingBean(DeadLetterPort.class)
        public KafkaDeadLetterPort kafkaDeadLetterPort(KafkaTemplate<String, byte[]> kafkaTemplate) {
            return new KafkaDeadLetterPort(kafkaTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "controlled-retry.listener", name = "enabled", havingValue = "true", matchIfMissing = true)
        public FailedMessageListener failedMessageListener(RetryController retryController) {
            return new FailedMessageListener(retryController);
        }
    }

    // ==================== SCHEDULER ====================

    @Configuration
    @ConditionalOnClass({JpaRepository.class, KafkaTemplate.class})
    @ConditionalOnProperty(prefix = "controlled-retry.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    @EnableScheduling
    @EntityScan(basePackageClasses = ScheduledRetry.class)
    @EnableJpaRepositories(basePackageClasses = ScheduledRetryRepository.class)
    static class SchedulerConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ExecutionRoleGrants executionRoleGrants(ControlledRetryProperties properties) {
            var grants = properties.getScheduler().getRoleGrants();
            if (grants == null || grants.isEmpty()) {
                return ExecutionRoleGrants.single(properties.getExecutionRole(), properties.getRetryTarget());
            }
            return new ExecutionRoleGrants(grants);
        }

        @Bean
        @ConditionalOnMissingBean(DelayedDeliveryPort.class)
        public JpaDelayedDeliveryPort jpaDelayedDeliveryPort(ScheduledRetryRepository repository,
                                                             ExecutionRoleGrants grants,
                                                             Clock retryClock) {
            return new JpaDelayedDeliveryPort(repository, grants, retryClock);
        }

        @Bean
        @ConditionalOnMissingBean
        public ScheduledRetryDispatcher scheduledRetryDispatcher(ScheduledRetryRepository repository,
                                                                 KafkaTemplate<String, byte[]> kafkaTemplate,
                                                                 ExecutionRoleGrants grants,
                                                                 Clock retryClock,
                                                                 ControlledRetryProperties properties) {
            return new ScheduledRetryDispatcher(repository, kafkaTemplate, grants, retryClock,
                    properties.getScheduler().getBatchSize());
        }
    }

    // ==================== METRICS ====================

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RetryMetrics retryMetrics(MeterRegistry registry,
                                         ObjectProvider<ScheduledRetryDispatcher> dispatcher) {
            RetryMetrics metrics = new RetryMetrics(registry);
            dispatcher.ifAvailable(d -> metrics.bindPendingSchedules(d::countPending));
            return metrics;
        }
    }
}
