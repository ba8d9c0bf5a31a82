package com.aporkolab.retry.scheduler;

import java.time.Instant;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ScheduledRetryRepository extends JpaRepository<ScheduledRetry, String> {

    /**
     * Due schedules, oldest fire time first.
     * Row locks with SKIP LOCKED keep several dispatcher instances from firing the same schedule.
     */
    @Query(value = """
        SELECT * FROM scheduled_retries
        WHERE state = 'ENABLED'
        AND fire_at <= :now
        ORDER BY fire_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<ScheduledRetry> findDueForUpdate(@Param("now") Instant now, @Param("limit") int limit);

    long countByState(ScheduleState state);
}
