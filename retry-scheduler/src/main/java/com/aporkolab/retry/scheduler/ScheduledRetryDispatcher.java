package com.aporkolab.retry.scheduler;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.transaction.annotation.Transactional;

import com.aporkolab.retry.core.schedule.ActionAfterCompletion;

/**
 * Fires due schedules: publishes each payload to its target topic, then deletes the row.
 * 
 * Design decisions:
 * - SKIP LOCKED polling, same as an outbox relay, for multi-instance safety
 * - Row deleted only after the broker acknowledged the send (fire once, auto-delete);
 *   schedules created with ActionAfterCompletion.NONE are kept as COMPLETED instead
 * - A failed send leaves the row enabled for the next poll
 * - A role that lost its grant disables the row instead of delivering
 */
public class ScheduledRetryDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ScheduledRetryDispatcher.class);

    private final ScheduledRetryRepository repository;
    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final ExecutionRoleGrants grants;
    private final Clock clock;
    private final int batchSize;

    public ScheduledRetryDispatcher(ScheduledRetryRepository repository,
                                    KafkaTemplate<String, byte[]> kafkaTemplate,
                                    ExecutionRoleGrants grants,
                                    Clock clock,
                                    int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.repository = repository;
        this.kafkaTemplate = kafkaTemplate;
        this.grants = grants;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    /**
     * @return number of schedules delivered in this poll
     */
    @Scheduled(fixedDelayString = "${controlled-retry.scheduler.poll-interval-ms:1000}")
    @Transactional
    public int dispatchDue() {
        List<ScheduledRetry> due = repository.findDueForUpdate(clock.instant(), batchSize);

        if (due.isEmpty()) {
            return 0;
        }

        log.debug("Dispatching {} due schedules", due.size());

        int delivered = 0;
        for (ScheduledRetry schedule : due) {
            if (!grants.isAllowed(schedule.getExecutionRole(), schedule.getTarget())) {
                String reason = String.format("Execution role '%s' is not allowed to deliver to '%s'",
                        schedule.getExecutionRole(), schedule.getTarget());
                log.error("Disabling schedule {}: {}", schedule.getName(), reason);
                schedule.disable(reason);
                repository.save(schedule);
                continue;
            }

            try {
                deliver(schedule);
                if (schedule.getActionAfterCompletion() == ActionAfterCompletion.DELETE) {
                    repository.delete(schedule);
                } else {
                    schedule.complete();
                    repository.save(schedule);
                }
                delivered++;
                log.debug("Delivered schedule: name={}, target={}", schedule.getName(), schedule.getTarget());
            } catch (ScheduleDeliveryException e) {
                log.error("Failed to deliver schedule {} to {}, will retry on next poll: {}",
                        schedule.getName(), schedule.getTarget(), e.getMessage());
            }
        }
        return delivered;
    }

    private void deliver(ScheduledRetry schedule) {
        // Synchronous send so the row is deleted only after acknowledgement
        try {
            kafkaTemplate.send(schedule.getTarget(), schedule.payloadBytes()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScheduleDeliveryException("Interrupted while delivering schedule " + schedule.getName(), e);
        } catch (Exception e) {
            throw new ScheduleDeliveryException("Kafka publish failed for schedule " + schedule.getName(), e);
        }
    }

    public long countPending() {
        return repository.countByState(ScheduleState.ENABLED);
    }

    public long countDisabled() {
        return repository.countByState(ScheduleState.DISABLED);
    }

    static class ScheduleDeliveryException extends RuntimeException {
        ScheduleDeliveryException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
