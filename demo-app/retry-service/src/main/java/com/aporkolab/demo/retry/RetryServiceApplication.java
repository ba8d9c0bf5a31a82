package com.aporkolab.demo.retry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Retry Service - demonstrates controlled retry with a final dead-letter topic.
 * 
 * Flow:
 * 1. Intake listener validates each message from the source topic
 * 2. Invalid messages go straight to the final DLQ (INVALID_MESSAGE_FORMAT / INVALID_MESSAGE_SCHEMA)
 * 3. Valid messages are processed; a failure moves the record to the intermediate topic
 * 4. The retry controller schedules a delayed re-delivery to the source topic (60s * attempt)
 * 5. After max attempts the original message lands in the final DLQ (RETRY_COUNT_EXCEEDED)
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(RetryServiceProperties.class)
public class RetryServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RetryServiceApplication.class, args);
    }
}
