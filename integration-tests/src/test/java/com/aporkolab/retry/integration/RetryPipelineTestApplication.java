package com.aporkolab.retry.integration;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Minimal application: only the auto-configured retry pipeline plus its topics.
 */
@SpringBootApplication
public class RetryPipelineTestApplication {

    static final String SOURCE_TOPIC = "it-source";
    static final String INTERMEDIATE_TOPIC = "it-intermediate";
    static final String FINAL_DLQ_TOPIC = "it-final-dlq";

    @Bean
    NewTopic sourceTopic() {
        return TopicBuilder.name(SOURCE_TOPIC).partitions(1).replicas(1).build();
    }

    @Bean
    NewTopic intermediateTopic() {
        return TopicBuilder.name(INTERMEDIATE_TOPIC).partitions(1).replicas(1).build();
    }

    @Bean
    NewTopic finalDlqTopic() {
        return TopicBuilder.name(FINAL_DLQ_TOPIC).partitions(1).replicas(1).build();
    }
}
