package com.aporkolab.retry.kafka;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.aporkolab.retry.core.sink.DeadLetterPort;
import com.aporkolab.retry.core.sink.DeadLetterRecord;

/**
 * Writes quarantined messages to the final dead-letter topic.
 * 
 * Design decisions:
 * - Value is the original message bytes, untouched
 * - Classification travels in the ErrorType / ErrorDetails headers
 * - Keyed by message id when known so one message lands on one partition
 * - Blocks until the broker acknowledged; a failed send is thrown to the sink
 */
public class KafkaDeadLetterPort implements DeadLetterPort {

    private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterPort.class);
    private static final long DEFAULT_SEND_TIMEOUT_MS = 10_000;

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final long sendTimeoutMs;

    public KafkaDeadLetterPort(KafkaTemplate<String, byte[]> kafkaTemplate) {
        this(kafkaTemplate, DEFAULT_SEND_TIMEOUT_MS);
    }

    public KafkaDeadLetterPort(KafkaTemplate<String, byte[]> kafkaTemplate, long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public void send(DeadLetterRecord record) {
        ProducerRecord<String, byte[]> dlqRecord = new ProducerRecord<>(
                record.getDestination(),
                record.getMessageId(),
                record.getOriginalBody()
        );
        dlqRecord.headers().add(DeadLetterRecord.ERROR_TYPE_ATTRIBUTE,
                record.getErrorType().name().getBytes(StandardCharsets.UTF_8));
        dlqRecord.headers().add(DeadLetterRecord.ERROR_DETAILS_ATTRIBUTE,
                record.getErrorDetails().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, byte[]> result = kafkaTemplate.send(dlqRecord).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            if (result != null && result.getRecordMetadata() != null) {
                log.debug("Dead letter written: topic={}, partition={}, offset={}",
                        record.getDestination(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while writing to " + record.getDestination(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Kafka rejected dead letter for " + record.getDestination(), e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("No acknowledgement from " + record.getDestination()
                    + " within " + sendTimeoutMs + "ms", e);
        }
    }
}
