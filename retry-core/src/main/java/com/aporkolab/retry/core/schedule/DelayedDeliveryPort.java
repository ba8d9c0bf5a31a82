package com.aporkolab.retry.core.schedule;

/**
 * Delayed-delivery service the retry scheduler writes to.
 * 
 * Implementations create exactly one single-fire schedule per call and report
 * rejection by throwing; the caller maps that to a scheduling failure.
 */
public interface DelayedDeliveryPort {

    ScheduleHandle createSchedule(ScheduleRequest request);
}
