package com.aporkolab.retry.core.exception;

/**
 * The failure notification, or the message body it carries, cannot be parsed.
 * Nothing well-formed exists to retry or quarantine, so the pass fails and the
 * transport's own redelivery takes over.
 */
public class MalformedNotificationException extends RetryException {

    public static final String CODE = "MALFORMED_NOTIFICATION";

    public MalformedNotificationException(String reason) {
        super(CODE, "Malformed failure notification: " + reason);
    }

    public MalformedNotificationException(String reason, Throwable cause) {
        super(CODE, "Malformed failure notification: " + reason, cause);
    }
}
