package com.aporkolab.retry.core.schedule;

import java.time.Instant;

/**
 * Identifies a schedule created by the delayed-delivery service.
 */
public record ScheduleHandle(String name, String target, Instant fireAt) {
}
