package com.aporkolab.demo.retry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Topics and processing switches of the demo service.
 */
@Validated
@ConfigurationProperties(prefix = "retry-service")
public class RetryServiceProperties {

    @NotBlank
    private String sourceTopic = "source-queue";

    @NotBlank
    private String intermediateTopic = "intermediate-dlq";

    @NotBlank
    private String finalDlqTopic = "final-dlq";

    private int partitions = 1;

    /** Fail every valid message on purpose so it walks the retry path. */
    private boolean simulateFailure = true;

    public String getSourceTopic() {
        return sourceTopic;
    }

    public void setSourceTopic(String sourceTopic) {
        this.sourceTopic = sourceTopic;
    }

    public String getIntermediateTopic() {
        return intermediateTopic;
    }

    public void setIntermediateTopic(String intermediateTopic) {
        this.intermediateTopic = intermediateTopic;
    }

    public String getFinalDlqTopic() {
        return finalDlqTopic;
    }

    public void setFinalDlqTopic(String finalDlqTopic) {
        this.finalDlqTopic = finalDlqTopic;
    }

    public int getPartitions() {
        return partitions;
    }

    public void setPartitions(int partitions) {
        this.partitions = partitions;
    }

    public boolean isSimulateFailure() {
        return simulateFailure;
    }

    public void setSimulateFailure(boolean simulateFailure) {
        this.simulateFailure = simulateFailure;
    }
}
