package com.aporkolab.demo.retry;

import com.fasterxml.jackson.databind.JsonNode;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record SubmitMessageRequest(
        @Pattern(regexp = IntakeMessage.UUID_PATTERN, message = "messageId must be a UUID")
        String messageId,

        @NotNull(message = "data is required")
        JsonNode data
) {}
