package com.aporkolab.retry.core.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for every failure a retry pass can surface.
 * 
 * Provides:
 * - Stable error code for log correlation and metric tags
 * - Structured context (message id, attempt count, destination)
 * - Timestamp of the failure
 */
public abstract class RetryException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected RetryException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    protected RetryException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Null values are skipped.
     */
    public RetryException with(String key, Object value) {
        if (value != null) {
            this.context.put(key, value);
        }
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
