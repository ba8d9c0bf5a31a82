package com.aporkolab.retry.spring.autoconfigure;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for controlled retry.
 * 
 * Example application.yml:
 * <pre>
 * controlled-retry:
 *   max-attempts: 5
 *   backoff-step: 60s
 *   retry-target: source-queue
 *   execution-role: scheduler-role
 *   dead-letter:
 *     destination: final-dlq
 *   listener:
 *     failed-topic: intermediate-dlq
 *   scheduler:
 *     poll-interval-ms: 1000
 *     role-grants:
 *       scheduler-role: source-queue
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "controlled-retry")
public class ControlledRetryProperties {

    private boolean enabled = true;

    @Min(1)
    private int maxAttempts = 5;

    @NotNull
    private Duration backoffStep = Duration.ofSeconds(60);

    /** Destination that scheduled retries are delivered to. */
    @NotBlank
    private String retryTarget;

    /** Role the delayed delivery runs as. */
    @NotBlank
    private String executionRole;

    @Valid
    private DeadLetterProperties deadLetter = new DeadLetterProperties();

    @Valid
    private ListenerProperties listener = new ListenerProperties();

    @Valid
    private SchedulerProperties scheduler = new SchedulerProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffStep() {
        return backoffStep;
    }

    public void setBackoffStep(Duration backoffStep) {
        this.backoffStep = backoffStep;
    }

    public String getRetryTarget() {
        return retryTarget;
    }

    public void setRetryTarget(String retryTarget) {
        this.retryTarget = retryTarget;
    }

    public String getExecutionRole() {
        return executionRole;
    }

    public void setExecutionRole(String executionRole) {
        this.executionRole = executionRole;
    }

    public DeadLetterProperties getDeadLetter() {
        return deadLetter;
    }

    public void setDeadLetter(DeadLetterProperties deadLetter) {
        this.deadLetter = deadLetter;
    }

    public ListenerProperties getListener() {
        return listener;
    }

    public void setListener(ListenerProperties listener) {
        this.listener = listener;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    // ==================== NESTED PROPERTIES CLASSES ====================

    public static class DeadLetterProperties {
        @NotBlank
        private String destination;

        @Min(32)
        private int maxDetailLength = 2000;

        public String getDestination() {
            return destination;
        }

        public void setDestination(String destination) {
            this.destination = destination;
        }

        public int getMaxDetailLength() {
            return maxDetailLength;
        }

        public void setMaxDetailLength(int maxDetailLength) {
            this.maxDetailLength = maxDetailLength;
        }
    }

    public static class ListenerProperties {
        private boolean enabled = true;
        private String failedTopic = "intermediate-dlq";
        private String groupId = "controlled-retry";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFailedTopic() {
            return failedTopic;
        }

        public void setFailedTopic(String failedTopic) {
            this.failedTopic = failedTopic;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }
    }

    public static class SchedulerProperties {
        private boolean enabled = true;

        @Min(1)
        private long pollIntervalMs = 1000;

        @Min(1)
        private int batchSize = 100;

        /** Destinations each execution role may deliver to. Empty means execution-role may deliver to retry-target only. */
        private Map<String, List<String>> roleGrants = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Map<String, List<String>> getRoleGrants() {
            return roleGrants;
        }

        public void setRoleGrants(Map<String, List<String>> roleGrants) {
            this.roleGrants = roleGrants;
        }
    }
}
