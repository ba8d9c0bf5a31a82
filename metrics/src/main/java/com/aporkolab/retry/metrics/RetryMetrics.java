package com.aporkolab.retry.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import com.aporkolab.retry.core.RetryListener;
import com.aporkolab.retry.core.exception.RetryException;
import com.aporkolab.retry.core.model.RetryMetadata;
import com.aporkolab.retry.core.schedule.ScheduleHandle;
import com.aporkolab.retry.core.sink.ErrorType;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer metrics for controlled retry.
 * 
 * Provides the following metrics:
 * - retry_scheduled_total: Retries handed to the delayed delivery service
 * - retry_scheduled_by_attempt_total: Same, tagged with the attempt number
 * - retry_quarantined_total: Messages written to the final dead-letter destination, by error type
 * - retry_pass_failures_total: Passes that ended in an exception, by error code
 * - retry_processing_duration: Time spent in one retry pass
 * - retry_schedules_pending: Schedules waiting to fire (when bound)
 */
public class RetryMetrics implements RetryListener {

    private static final String METRIC_PREFIX = "retry";

    private final MeterRegistry registry;
    private final Tags baseTags;

    private final Counter scheduledCounter;
    private final Timer processingTimer;

    public RetryMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public RetryMetrics(MeterRegistry registry, String serviceName) {
        this(registry, Tags.of("service", serviceName));
    }

    public RetryMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        this.scheduledCounter = Counter.builder(METRIC_PREFIX + "_scheduled_total")
                .description("Total retries scheduled for delayed delivery")
                .tags(baseTags)
                .register(registry);

        this.processingTimer = Timer.builder(METRIC_PREFIX + "_processing_duration")
                .description("Time to process one failed-message notification")
                .tags(baseTags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    @Override
    public void onRetryScheduled(RetryMetadata metadata, ScheduleHandle schedule, Duration elapsed) {
        scheduledCounter.increment();

        Counter.builder(METRIC_PREFIX + "_scheduled_by_attempt_total")
                .tags(baseTags.and("attempt", String.valueOf(metadata.retryCount())))
                .description("Retries scheduled by attempt number")
                .register(registry)
                .increment();

        processingTimer.record(elapsed);
    }

    @Override
    public void onQuarantined(RetryMetadata metadata, ErrorType errorType, Duration elapsed) {
        recordQuarantine(errorType);
        processingTimer.record(elapsed);
    }

    @Override
    public void onPassFailed(RetryException failure, Duration elapsed) {
        Counter.builder(METRIC_PREFIX + "_pass_failures_total")
                .tags(baseTags.and("code", failure.getCode()))
                .description("Retry passes that failed and were left for redelivery")
                .register(registry)
                .increment();

        processingTimer.record(elapsed);
    }

    /**
     * Record a quarantine that did not go through the retry controller (e.g. validation).
     */
    public void recordQuarantine(ErrorType errorType) {
        Counter.builder(METRIC_PREFIX + "_quarantined_total")
                .tags(baseTags.and("error_type", errorType.name()))
                .description("Messages sent to the final dead-letter destination")
                .register(registry)
                .increment();
    }

    /**
     * Expose the number of schedules waiting to fire.
     */
    public void bindPendingSchedules(Supplier<Number> pending) {
        Gauge.builder(METRIC_PREFIX + "_schedules_pending", pending)
                .description("Retry schedules waiting to fire")
                .tags(baseTags)
                .register(registry);
    }

    public double getScheduledCount() {
        return scheduledCounter.count();
    }

    public double getQuarantinedCount(ErrorType errorType) {
        Counter counter = registry.find(METRIC_PREFIX + "_quarantined_total")
                .tags(baseTags.and("error_type", errorType.name()))
                .counter();
        return counter == null ? 0.0 : counter.count();
    }
}
