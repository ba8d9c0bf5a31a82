package com.aporkolab.retry.scheduler;

/**
 * The schedule store refused a create-schedule request.
 */
public class ScheduleRejectedException extends RuntimeException {

    public ScheduleRejectedException(String message) {
        super(message);
    }

    public ScheduleRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
