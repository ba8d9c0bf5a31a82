package com.aporkolab.retry.core.exception;

/**
 * The dead-letter write failed. Losing it would lose the message, so the pass fails.
 */
public class SinkUnavailableException extends RetryException {

    public static final String CODE = "SINK_UNAVAILABLE";

    public SinkUnavailableException(String destination, String errorType, Throwable cause) {
        super(CODE, String.format("Dead-letter write to '%s' failed (%s): %s",
                destination, errorType, cause.getMessage()), cause);
        with("destination", destination);
        with("errorType", errorType);
    }
}
