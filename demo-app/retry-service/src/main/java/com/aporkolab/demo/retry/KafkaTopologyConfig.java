package com.aporkolab.demo.retry;

import java.util.Map;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

import com.aporkolab.retry.core.exception.MalformedNotificationException;
import com.aporkolab.retry.core.exception.SinkUnavailableException;

/**
 * Topics and listener error handling.
 * 
 * Design decisions:
 * - Intake failures are moved to the intermediate topic on the first failure (no local retries)
 * - A failed quarantine of an invalid intake message is retried in place
 * - Retry passes that fail are redelivered indefinitely, one second apart
 * - A malformed notification is logged and skipped; redelivering it can never succeed
 */
@Configuration
public class KafkaTopologyConfig {

    private static final Logger log = LoggerFactory.getLogger(KafkaTopologyConfig.class);

    public static final String INTAKE_CONTAINER_FACTORY = "intakeContainerFactory";

    private static final long RETRY_PASS_REDELIVERY_INTERVAL_MS = 1000L;

    @Bean
    public NewTopic sourceTopic(RetryServiceProperties properties) {
        return TopicBuilder.name(properties.getSourceTopic()).partitions(properties.getPartitions()).replicas(1).build();
    }

    @Bean
    public NewTopic intermediateTopic(RetryServiceProperties properties) {
        return TopicBuilder.name(properties.getIntermediateTopic()).partitions(properties.getPartitions()).replicas(1).build();
    }

    @Bean
    public NewTopic finalDlqTopic(RetryServiceProperties properties) {
        return TopicBuilder.name(properties.getFinalDlqTopic()).partitions(properties.getPartitions()).replicas(1).build();
    }

    /**
     * Picked up by Boot's default container factory, which the retry listener uses.
     */
    @Bean
    public DefaultErrorHandler retryPassErrorHandler() {
        DefaultErrorHandler handler = new DefaultErrorHandler(
                (record, ex) -> log.error("Dropping malformed failure notification {}-{}@{}: {}",
                        record.topic(), record.partition(), record.offset(), ex.getMessage()),
                new FixedBackOff(RETRY_PASS_REDELIVERY_INTERVAL_MS, FixedBackOff.UNLIMITED_ATTEMPTS));
        handler.addNotRetryableExceptions(MalformedNotificationException.class);
        return handler;
    }

    @Bean(INTAKE_CONTAINER_FACTORY)
    public ConcurrentKafkaListenerContainerFactory<Object, Object> intakeContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory,
            KafkaTemplate<String, byte[]> kafkaTemplate,
            RetryServiceProperties properties) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> factory = new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(factory, consumerFactory);

        String intermediateTopic = properties.getIntermediateTopic();
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
                (record, ex) -> new TopicPartition(intermediateTopic, -1));
        DefaultErrorHandler handler = new DefaultErrorHandler(recoverer,
                new FixedBackOff(RETRY_PASS_REDELIVERY_INTERVAL_MS, FixedBackOff.UNLIMITED_ATTEMPTS));
        // Only a failed quarantine write is retried in place; everything else moves on at once
        handler.setClassifications(Map.of(SinkUnavailableException.class, true), false);
        factory.setCommonErrorHandler(handler);
        return factory;
    }
}
