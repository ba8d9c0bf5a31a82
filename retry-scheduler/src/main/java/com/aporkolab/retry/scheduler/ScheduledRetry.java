package com.aporkolab.retry.scheduler;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.springframework.data.domain.Persistable;

import com.aporkolab.retry.core.schedule.ActionAfterCompletion;
import com.aporkolab.retry.core.schedule.ScheduleHandle;
import com.aporkolab.retry.core.schedule.ScheduleRequest;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

/**
 * A one-shot delivery waiting for its fire time.
 * Rows are deleted once delivered unless created with {@link ActionAfterCompletion#NONE},
 * in which case they stay as {@link ScheduleState#COMPLETED}.
 */
@Entity
@Table(name = "scheduled_retries")
public class ScheduledRetry implements Persistable<String> {

    @Id
    @Column(name = "name", nullable = false, length = 64)
    private String name;

    @Column(name = "fire_at", nullable = false)
    private Instant fireAt;

    @Column(name = "target", nullable = false, length = 255)
    private String target;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "execution_role", nullable = false, length = 255)
    private String executionRole;

    @Column(name = "description", length = 512)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_after_completion", nullable = false, length = 20)
    private ActionAfterCompletion actionAfterCompletion;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private ScheduleState state;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "disabled_reason", length = 512)
    private String disabledReason;

    @Transient
    private boolean isNew = true;

    protected ScheduledRetry() {}

    public ScheduledRetry(ScheduleRequest request, Instant createdAt) {
        this.name = request.name();
        this.fireAt = request.fireAt();
        this.target = request.target();
        this.payload = request.payload();
        this.executionRole = request.executionRole();
        this.description = request.description();
        this.actionAfterCompletion = request.actionAfterCompletion();
        this.state = ScheduleState.ENABLED;
        this.createdAt = createdAt;
    }

    public void disable(String reason) {
        this.state = ScheduleState.DISABLED;
        this.disabledReason = reason;
    }

    public void complete() {
        this.state = ScheduleState.COMPLETED;
    }

    public boolean isDue(Instant now) {
        return state == ScheduleState.ENABLED && !fireAt.isAfter(now);
    }

    public ScheduleHandle toHandle() {
        return new ScheduleHandle(name, target, fireAt);
    }

    public byte[] payloadBytes() {
        return payload.getBytes(StandardCharsets.UTF_8);
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    @Override
    public String getId() {
        return name;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    // Getters
    public String getName() { return name; }
    public Instant getFireAt() { return fireAt; }
    public String getTarget() { return target; }
    public String getPayload() { return payload; }
    public String getExecutionRole() { return executionRole; }
    public String getDescription() { return description; }
    public ActionAfterCompletion getActionAfterCompletion() { return actionAfterCompletion; }
    public ScheduleState getState() { return state; }
    public Instant getCreatedAt() { return createdAt; }
    public String getDisabledReason() { return disabledReason; }
}
