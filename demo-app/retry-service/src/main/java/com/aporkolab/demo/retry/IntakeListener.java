package com.aporkolab.demo.retry;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import com.aporkolab.retry.core.sink.DeadLetterSink;
import com.aporkolab.retry.metrics.RetryMetrics;

/**
 * Consumes the source topic.
 * 
 * Invalid messages are quarantined and acknowledged here; that is the only place a
 * failure is swallowed. Processing failures propagate so the container's error
 * handler moves the record to the intermediate topic.
 */
@Component
public class IntakeListener {

    private static final Logger log = LoggerFactory.getLogger(IntakeListener.class);
    private static final byte[] EMPTY = new byte[0];

    private final MessageValidator validator;
    private final MessageProcessor processor;
    private final DeadLetterSink deadLetterSink;
    private final ObjectProvider<RetryMetrics> metrics;

    public IntakeListener(MessageValidator validator,
                          MessageProcessor processor,
                          DeadLetterSink deadLetterSink,
                          ObjectProvider<RetryMetrics> metrics) {
        this.validator = validator;
        this.processor = processor;
        this.deadLetterSink = deadLetterSink;
        this.metrics = metrics;
    }

    @KafkaListener(
            id = "intake-listener",
            topics = "${retry-service.source-topic:source-queue}",
            groupId = "retry-service",
            containerFactory = KafkaTopologyConfig.INTAKE_CONTAINER_FACTORY
    )
    public void onMessage(ConsumerRecord<String, byte[]> record) {
        byte[] body = record.value() != null ? record.value() : EMPTY;

        IntakeMessage message;
        try {
            message = validator.validate(body);
        } catch (InvalidMessageException e) {
            log.warn("Rejecting invalid message from {}-{}@{}: {} {}",
                    record.topic(), record.partition(), record.offset(), e.getErrorType(), e.getMessage());
            deadLetterSink.quarantine(record.key(), body, e.getErrorType(), e.getMessage());
            metrics.ifAvailable(m -> m.recordQuarantine(e.getErrorType()));
            return;
        }

        processor.process(message);
    }
}
