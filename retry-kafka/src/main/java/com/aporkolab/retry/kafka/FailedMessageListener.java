package com.aporkolab.retry.kafka;

import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;

import com.aporkolab.retry.core.RetryController;
import com.aporkolab.retry.core.RetryOutcome;
import com.aporkolab.retry.core.model.FailedMessageNotification;

/**
 * Feeds records from the intermediate failure topic into the retry controller.
 * 
 * One record per invocation. Exceptions are not caught here: the container's
 * error handler leaves the offset uncommitted and the record is redelivered.
 */
public class FailedMessageListener {

    private static final Logger log = LoggerFactory.getLogger(FailedMessageListener.class);

    public static final String SOURCE_TOPIC = "topic";
    public static final String SOURCE_PARTITION = "partition";
    public static final String SOURCE_OFFSET = "offset";

    private final RetryController controller;

    public FailedMessageListener(RetryController controller) {
        this.controller = controller;
    }

    @KafkaListener(
            id = "controlled-retry-listener",
            topics = "${controlled-retry.listener.failed-topic:intermediate-dlq}",
            groupId = "${controlled-retry.listener.group-id:controlled-retry}"
    )
    public void onFailedMessage(ConsumerRecord<String, byte[]> record) {
        RetryOutcome outcome = controller.handle(toNotification(record));
        log.debug("Processed failed message {}-{}@{}: {}",
                record.topic(), record.partition(), record.offset(), outcome.decision());
    }

    static FailedMessageNotification toNotification(ConsumerRecord<String, byte[]> record) {
        return new FailedMessageNotification(
                record.topic(),
                record.value(),
                Map.of(SOURCE_TOPIC, record.topic(),
                        SOURCE_PARTITION, String.valueOf(record.partition()),
                        SOURCE_OFFSET, String.valueOf(record.offset())));
    }
}
