package com.aporkolab.retry.core.schedule;

import java.time.Instant;
import java.util.Objects;

/**
 * A one-shot delivery: at {@code fireAt}, deliver {@code payload} to {@code target}
 * acting as {@code executionRole}. No recurrence.
 */
public record ScheduleRequest(
        String name,
        Instant fireAt,
        String target,
        String payload,
        String executionRole,
        String description,
        ActionAfterCompletion actionAfterCompletion) {

    public ScheduleRequest {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(fireAt, "fireAt must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(executionRole, "executionRole must not be null");
        if (actionAfterCompletion == null) {
            actionAfterCompletion = ActionAfterCompletion.DELETE;
        }
    }
}
