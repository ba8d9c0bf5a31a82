package com.aporkolab.demo.retry;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aporkolab.retry.core.RetryController;
import com.aporkolab.retry.scheduler.ScheduledRetryDispatcher;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/api/v1/retries")
@Tag(name = "Retries", description = "Retry pipeline status")
public class RetryStatsController {

    private final ScheduledRetryDispatcher dispatcher;
    private final RetryController retryController;
    private final MessageProcessor processor;

    public RetryStatsController(ScheduledRetryDispatcher dispatcher,
                                RetryController retryController,
                                MessageProcessor processor) {
        this.dispatcher = dispatcher;
        this.retryController = retryController;
        this.processor = processor;
    }

    @GetMapping("/stats")
    @Operation(summary = "Retry statistics", description = "Pending and disabled schedules plus processing counters")
    public ResponseEntity<RetryStats> stats() {
        return ResponseEntity.ok(new RetryStats(
                dispatcher.countPending(),
                dispatcher.countDisabled(),
                retryController.getMaxAttempts(),
                processor.getProcessedCount(),
                processor.getFailedCount()
        ));
    }

    public record RetryStats(long pendingSchedules, long disabledSchedules, int maxAttempts,
                             long processedMessages, long failedMessages) {}
}
