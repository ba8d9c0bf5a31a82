package com.aporkolab.retry.core.sink;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.retry.core.RetrySettings;
import com.aporkolab.retry.core.exception.SinkUnavailableException;

/**
 * Quarantines messages that will not be retried.
 * 
 * The original bytes are forwarded as received, never re-serialized, so the
 * operator sees exactly what failed. Duplicate quarantines of the same message
 * are not de-duplicated.
 */
public class DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterSink.class);
    private static final String TRUNCATION_MARKER = "...(truncated)";

    private final DeadLetterPort port;
    private final String destination;
    private final int maxDetailLength;

    public DeadLetterSink(DeadLetterPort port, RetrySettings settings) {
        this.port = Objects.requireNonNull(port, "port must not be null");
        this.destination = settings.getDeadLetterDestination();
        this.maxDetailLength = settings.getMaxDetailLength();
    }

    public void quarantine(byte[] originalBody, ErrorType errorType, String detail) {
        quarantine(null, originalBody, errorType, detail);
    }

    public void quarantine(String messageId, byte[] originalBody, ErrorType errorType, String detail) {
        DeadLetterRecord record = new DeadLetterRecord(
                destination, messageId, originalBody, errorType, truncate(detail));
        try {
            port.send(record);
        } catch (RuntimeException e) {
            throw new SinkUnavailableException(destination, errorType.name(), e);
        }
        log.info("Message sent to dead-letter destination: destination={}, messageId={}, errorType={}",
                destination, messageId, errorType);
    }

    String truncate(String detail) {
        if (detail == null) {
            return "";
        }
        if (detail.length() <= maxDetailLength) {
            return detail;
        }
        return detail.substring(0, maxDetailLength - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }
}
