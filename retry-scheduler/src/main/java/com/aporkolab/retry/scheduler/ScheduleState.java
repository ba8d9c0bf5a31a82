package com.aporkolab.retry.scheduler;

public enum ScheduleState {
    ENABLED,
    DISABLED,
    /** Fired, kept because it was created with ActionAfterCompletion.NONE. */
    COMPLETED
}
