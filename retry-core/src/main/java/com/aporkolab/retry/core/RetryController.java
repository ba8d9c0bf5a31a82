package com.aporkolab.retry.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.retry.core.exception.MalformedNotificationException;
import com.aporkolab.retry.core.exception.RetryException;
import com.aporkolab.retry.core.logging.RetryLogContext;
import com.aporkolab.retry.core.model.FailedMessageNotification;
import com.aporkolab.retry.core.model.RetryMessage;
import com.aporkolab.retry.core.model.RetryMessageCodec;
import com.aporkolab.retry.core.model.RetryMetadata;
import com.aporkolab.retry.core.policy.AttemptLimiter;
import com.aporkolab.retry.core.policy.AttemptVerdict;
import com.aporkolab.retry.core.policy.BackoffPolicy;
import com.aporkolab.retry.core.schedule.RetryScheduler;
import com.aporkolab.retry.core.schedule.ScheduleHandle;
import com.aporkolab.retry.core.sink.DeadLetterSink;
import com.aporkolab.retry.core.sink.ErrorType;

/**
 * Routes one failed message per call to either a delayed retry or the dead-letter sink.
 * 
 * Pass:
 * 1. Decode the body and increment the retry count
 * 2. Over budget: quarantine the original bytes as {@link ErrorType#RETRY_COUNT_EXCEEDED}
 * 3. Otherwise: stamp the next retry time and create one schedule
 * 
 * Holds no per-message state, so concurrent invocations need no coordination.
 * Every {@link RetryException} propagates so the invoking transport redelivers
 * the whole pass; nothing is retried in-process.
 */
public class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final RetryMessageCodec codec;
    private final AttemptLimiter attemptLimiter;
    private final BackoffPolicy backoffPolicy;
    private final RetryScheduler scheduler;
    private final DeadLetterSink deadLetterSink;
    private final Clock clock;
    private final List<RetryListener> listeners;

    public RetryController(RetryMessageCodec codec,
                           AttemptLimiter attemptLimiter,
                           BackoffPolicy backoffPolicy,
                           RetryScheduler scheduler,
                           DeadLetterSink deadLetterSink,
                           Clock clock,
                           List<RetryListener> listeners) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.attemptLimiter = Objects.requireNonNull(attemptLimiter, "attemptLimiter must not be null");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.deadLetterSink = Objects.requireNonNull(deadLetterSink, "deadLetterSink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    /**
     * Handle a single failed-message notification.
     *
     * @throws MalformedNotificationException if there is no parseable message to act on
     * @throws com.aporkolab.retry.core.exception.SchedulingFailureException if the retry could not be scheduled
     * @throws com.aporkolab.retry.core.exception.SinkUnavailableException if the quarantine write failed
     */
    public RetryOutcome handle(FailedMessageNotification notification) {
        long startNanos = System.nanoTime();
        String source = notification != null ? notification.getSource() : null;

        try (RetryLogContext context = RetryLogContext.open(source)) {
            try {
                return process(notification, context, startNanos);
            } catch (RetryException e) {
                log.error("Retry pass failed: code={}, context={}, reason={}",
                        e.getCode(), e.getContext(), e.getMessage());
                Duration elapsed = elapsedSince(startNanos);
                listeners.forEach(listener -> listener.onPassFailed(e, elapsed));
                throw e;
            }
        }
    }

    private RetryOutcome process(FailedMessageNotification notification, RetryLogContext context, long startNanos) {
        if (notification == null || !notification.hasBody()) {
            throw new MalformedNotificationException("notification carries no message body");
        }

        byte[] originalBody = notification.getBody();
        RetryMessage message = codec.decode(originalBody);
        RetryMetadata received = message.getMetadata();
        context.withMessageId(received.messageId()).withRetryCount(received.retryCount());

        RetryMetadata metadata;
        try {
            metadata = received.increment();
        } catch (ArithmeticException e) {
            // a count past Integer.MAX_VALUE is beyond any attempt limit
            return quarantine(received, originalBody, startNanos);
        }
        context.withRetryCount(metadata.retryCount());

        if (attemptLimiter.classify(metadata.retryCount()) == AttemptVerdict.EXHAUSTED) {
            return quarantine(metadata, originalBody, startNanos);
        }

        Instant fireTime = backoffPolicy.nextFireTime(clock.instant(), metadata.retryCount());
        RetryMetadata stamped = metadata.withNextRetryTime(fireTime);
        ScheduleHandle handle = scheduler.schedule(message.withMetadata(stamped), fireTime);

        String nextRetryTime = RetryMessageCodec.formatInstant(stamped.nextRetryTime());
        context.withNextRetryTime(nextRetryTime);
        log.info("Retry scheduled: messageId={}, retryCount={}, nextRetryTime={}, schedule={}",
                stamped.messageId(), stamped.retryCount(), nextRetryTime, handle.name());

        Duration elapsed = elapsedSince(startNanos);
        listeners.forEach(listener -> listener.onRetryScheduled(stamped, handle, elapsed));
        return RetryOutcome.scheduled(stamped, handle);
    }

    private RetryOutcome quarantine(RetryMetadata metadata, byte[] originalBody, long startNanos) {
        String detail = String.format("Max retry attempts %d exceeded", attemptLimiter.getMaxAttempts());
        log.warn("Max retry attempts exceeded: messageId={}, retryCount={}, maxAttempts={}",
                metadata.messageId(), metadata.retryCount(), attemptLimiter.getMaxAttempts());

        deadLetterSink.quarantine(metadata.messageId(), originalBody, ErrorType.RETRY_COUNT_EXCEEDED, detail);

        Duration elapsed = elapsedSince(startNanos);
        listeners.forEach(listener -> listener.onQuarantined(metadata, ErrorType.RETRY_COUNT_EXCEEDED, elapsed));
        return RetryOutcome.exhausted(metadata);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public int getMaxAttempts() {
        return attemptLimiter.getMaxAttempts();
    }
}
