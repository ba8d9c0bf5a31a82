package com.aporkolab.retry.core.exception;

/**
 * The delayed-delivery service rejected or failed a create-schedule call.
 */
public class SchedulingFailureException extends RetryException {

    public static final String CODE = "SCHEDULING_FAILURE";

    public SchedulingFailureException(String messageId, String scheduleName, Throwable cause) {
        super(CODE, String.format("Failed to schedule retry '%s' for message %s: %s",
                scheduleName, messageId, cause.getMessage()), cause);
        with("messageId", messageId);
        with("scheduleName", scheduleName);
    }
}
