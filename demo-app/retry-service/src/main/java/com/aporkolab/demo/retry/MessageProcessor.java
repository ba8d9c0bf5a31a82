package com.aporkolab.demo.retry;

import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Business step of the demo. With simulate-failure on, every valid message fails
 * so it travels the whole retry path until it is quarantined.
 */
@Service
public class MessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    private final RetryServiceProperties properties;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public MessageProcessor(RetryServiceProperties properties) {
        this.properties = properties;
    }

    public void process(IntakeMessage message) {
        Integer attempt = message.metadata().retryCount();
        if (properties.isSimulateFailure()) {
            failed.incrementAndGet();
            log.info("Failing message {} on purpose (retry_count={})", message.messageId(), attempt);
            throw new MessageProcessingException(message.messageId(), "This exception is intentionally thrown");
        }

        processed.incrementAndGet();
        log.info("Processed message {} (retry_count={})", message.messageId(), attempt);
    }

    public long getProcessedCount() {
        return processed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }
}
