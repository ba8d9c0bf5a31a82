package com.aporkolab.retry.core.schedule;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.retry.core.RetrySettings;
import com.aporkolab.retry.core.exception.SchedulingFailureException;
import com.aporkolab.retry.core.model.RetryMessage;
import com.aporkolab.retry.core.model.RetryMessageCodec;

/**
 * Arranges the durable, delayed re-delivery of a message to its intake destination.
 * 
 * Design decisions:
 * - Fresh random schedule name per call; concurrent invocations share no counter
 * - Single-shot: no retry loop here, failures surface as {@link SchedulingFailureException}
 * - The execution role is passed through, never the identity that created the schedule
 */
public class RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    private final DelayedDeliveryPort deliveryPort;
    private final RetryMessageCodec codec;
    private final String retryTarget;
    private final String executionRole;

    public RetryScheduler(DelayedDeliveryPort deliveryPort, RetryMessageCodec codec, RetrySettings settings) {
        this.deliveryPort = Objects.requireNonNull(deliveryPort, "deliveryPort must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.retryTarget = settings.getRetryTarget();
        this.executionRole = settings.getExecutionRole();
    }

    public ScheduleHandle schedule(RetryMessage message, Instant fireTime) {
        String name = UUID.randomUUID().toString();
        ScheduleRequest request = new ScheduleRequest(
                name,
                fireTime,
                retryTarget,
                codec.encodeToString(message),
                executionRole,
                "Schedule for message retry: " + message.getMessageId(),
                ActionAfterCompletion.DELETE);

        try {
            ScheduleHandle handle = deliveryPort.createSchedule(request);
            log.debug("Created schedule {} for message {} at {}", name, message.getMessageId(), fireTime);
            return handle;
        } catch (RuntimeException e) {
            throw new SchedulingFailureException(message.getMessageId(), name, e);
        }
    }
}
