package com.aporkolab.retry.scheduler;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import com.aporkolab.retry.core.schedule.DelayedDeliveryPort;
import com.aporkolab.retry.core.schedule.ScheduleHandle;
import com.aporkolab.retry.core.schedule.ScheduleRequest;

/**
 * Stores each create-schedule request as one {@link ScheduledRetry} row.
 * 
 * Design decisions:
 * - Names are primary keys; an existing name is rejected, never overwritten
 * - The execution role must be granted the target before the row is written
 * - Failures are thrown as-is; the retry scheduler maps them to a scheduling failure
 */
public class JpaDelayedDeliveryPort implements DelayedDeliveryPort {

    private static final Logger log = LoggerFactory.getLogger(JpaDelayedDeliveryPort.class);

    private final ScheduledRetryRepository repository;
    private final ExecutionRoleGrants grants;
    private final Clock clock;

    public JpaDelayedDeliveryPort(ScheduledRetryRepository repository, ExecutionRoleGrants grants, Clock clock) {
        this.repository = repository;
        this.grants = grants;
        this.clock = clock;
    }

    @Override
    @Transactional
    public ScheduleHandle createSchedule(ScheduleRequest request) {
        if (!grants.isAllowed(request.executionRole(), request.target())) {
            throw new ScheduleRejectedException(String.format(
                    "Execution role '%s' is not allowed to deliver to '%s'",
                    request.executionRole(), request.target()));
        }
        if (repository.existsById(request.name())) {
            throw new ScheduleRejectedException("Schedule '" + request.name() + "' already exists");
        }

        try {
            ScheduledRetry schedule = repository.saveAndFlush(new ScheduledRetry(request, clock.instant()));
            log.debug("Stored schedule: name={}, target={}, fireAt={}",
                    schedule.getName(), schedule.getTarget(), schedule.getFireAt());
            return schedule.toHandle();
        } catch (DataIntegrityViolationException e) {
            throw new ScheduleRejectedException("Schedule '" + request.name() + "' could not be stored", e);
        }
    }
}
