package com.aporkolab.retry.core.logging;

import java.util.Map;

import org.slf4j.MDC;

/**
 * Scopes the identifying fields of one retry pass into the MDC, so every log
 * line written during the pass can be correlated by message id and attempt.
 * 
 * Usage:
 * <pre>
 * try (var ctx = RetryLogContext.open(source)) {
 *     ctx.withMessageId(id).withRetryCount(count);
 *     log.info("...");
 * }
 * </pre>
 */
public final class RetryLogContext implements AutoCloseable {

    public static final String MESSAGE_ID_KEY = "messageId";
    public static final String RETRY_COUNT_KEY = "retryCount";
    public static final String NEXT_RETRY_TIME_KEY = "nextRetryTime";
    public static final String SOURCE_KEY = "retrySource";

    private final Map<String, String> previousContext;

    private RetryLogContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    public static RetryLogContext open(String source) {
        RetryLogContext context = new RetryLogContext(MDC.getCopyOfContextMap());
        return context.with(SOURCE_KEY, source);
    }

    public RetryLogContext with(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
        return this;
    }

    public RetryLogContext withMessageId(String messageId) {
        return with(MESSAGE_ID_KEY, messageId);
    }

    public RetryLogContext withRetryCount(int retryCount) {
        return with(RETRY_COUNT_KEY, String.valueOf(retryCount));
    }

    public RetryLogContext withNextRetryTime(String nextRetryTime) {
        return with(NEXT_RETRY_TIME_KEY, nextRetryTime);
    }

    @Override
    public void close() {
        if (previousContext != null) {
            MDC.setContextMap(previousContext);
        } else {
            MDC.clear();
        }
    }
}
