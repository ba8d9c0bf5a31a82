package com.aporkolab.demo.retry;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Puts messages on the source topic, wrapped in the metadata/data envelope.
 */
@Service
public class MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(MessagePublisher.class);
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final RetryServiceProperties properties;

    public MessagePublisher(KafkaTemplate<String, byte[]> kafkaTemplate,
                            ObjectMapper objectMapper,
                            RetryServiceProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public SubmitMessageResponse submit(SubmitMessageRequest request) {
        String messageId = request.messageId() != null ? request.messageId() : UUID.randomUUID().toString();

        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.putObject("metadata").put("message_id", messageId);
        envelope.set("data", request.data());

        try {
            return send(messageId, objectMapper.writeValueAsBytes(envelope));
        } catch (JsonProcessingException e) {
            throw new MessagePublishException("Cannot serialize message " + messageId, e);
        }
    }

    /**
     * Publishes the body as-is, without any validation.
     */
    public SubmitMessageResponse submitRaw(String key, String body) {
        return send(key, body.getBytes(StandardCharsets.UTF_8));
    }

    private SubmitMessageResponse send(String key, byte[] payload) {
        String topic = properties.getSourceTopic();
        try {
            SendResult<String, byte[]> result = kafkaTemplate.send(topic, key, payload)
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            RecordMetadata metadata = result.getRecordMetadata();
            log.info("Submitted message {} to {}-{}@{}", key, topic, metadata.partition(), metadata.offset());
            return new SubmitMessageResponse(key, topic, metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagePublishException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new MessagePublishException("Failed to publish to " + topic, e);
        }
    }
}
