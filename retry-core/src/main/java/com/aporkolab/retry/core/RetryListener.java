package com.aporkolab.retry.core;

import java.time.Duration;

import com.aporkolab.retry.core.exception.RetryException;
import com.aporkolab.retry.core.model.RetryMetadata;
import com.aporkolab.retry.core.schedule.ScheduleHandle;
import com.aporkolab.retry.core.sink.ErrorType;

/**
 * Callbacks for monitoring integration. All methods default to no-op.
 * Called on the retry pass thread; listeners must not throw.
 */
public interface RetryListener {

    default void onRetryScheduled(RetryMetadata metadata, ScheduleHandle schedule, Duration elapsed) {}

    default void onQuarantined(RetryMetadata metadata, ErrorType errorType, Duration elapsed) {}

    default void onPassFailed(RetryException failure, Duration elapsed) {}
}
