package com.aporkolab.retry.core;

import java.util.Optional;

import com.aporkolab.retry.core.model.RetryMetadata;
import com.aporkolab.retry.core.schedule.ScheduleHandle;

/**
 * Result of one successful pass through the {@link RetryController}.
 *
 * @param decision what happened to the message
 * @param metadata metadata after the pass (incremented, and stamped when scheduled)
 * @param schedule the created schedule, present only for {@link Decision#SCHEDULED}
 */
public record RetryOutcome(Decision decision, RetryMetadata metadata, ScheduleHandle schedule) {

    public enum Decision {
        SCHEDULED,
        EXHAUSTED
    }

    public static RetryOutcome scheduled(RetryMetadata metadata, ScheduleHandle schedule) {
        return new RetryOutcome(Decision.SCHEDULED, metadata, schedule);
    }

    public static RetryOutcome exhausted(RetryMetadata metadata) {
        return new RetryOutcome(Decision.EXHAUSTED, metadata, null);
    }

    public boolean isScheduled() {
        return decision == Decision.SCHEDULED;
    }

    public Optional<ScheduleHandle> scheduleHandle() {
        return Optional.ofNullable(schedule);
    }
}
