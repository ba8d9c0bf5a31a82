package com.aporkolab.demo.retry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Shape every message on the source topic must have.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntakeMessage(
        @NotNull(message = "metadata is required")
        @Valid
        Metadata metadata,

        @NotNull(message = "data is required")
        JsonNode data
) {

    public static final String UUID_PATTERN =
            "^[a-fA-F0-9]{8}-[a-fA-F0-9]{4}-[a-fA-F0-9]{4}-[a-fA-F0-9]{4}-[a-fA-F0-9]{12}$";

    @JsonIgnore
    @AssertTrue(message = "data must be a JSON object")
    public boolean isDataObject() {
        return data == null || data.isObject();
    }

    public String messageId() {
        return metadata != null ? metadata.messageId() : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
            @JsonProperty("message_id")
            @NotBlank(message = "message_id is required")
            @Pattern(regexp = UUID_PATTERN, message = "message_id must be a UUID")
            String messageId,

            @JsonProperty("retry_count")
            @PositiveOrZero(message = "retry_count must not be negative")
            Integer retryCount
    ) {}
}
