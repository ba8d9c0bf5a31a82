package com.aporkolab.retry.core.sink;

import java.util.Arrays;
import java.util.Objects;

/**
 * Original message bytes plus their classification. Written once, never read back.
 */
public final class DeadLetterRecord {

    public static final String ERROR_TYPE_ATTRIBUTE = "ErrorType";
    public static final String ERROR_DETAILS_ATTRIBUTE = "ErrorDetails";

    private final String destination;
    private final String messageId;
    private final byte[] originalBody;
    private final ErrorType errorType;
    private final String errorDetails;

    public DeadLetterRecord(String destination, String messageId, byte[] originalBody,
                            ErrorType errorType, String errorDetails) {
        this.destination = Objects.requireNonNull(destination, "destination must not be null");
        this.messageId = messageId;
        this.originalBody = Objects.requireNonNull(originalBody, "originalBody must not be null").clone();
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
        this.errorDetails = errorDetails != null ? errorDetails : "";
    }

    public String getDestination() { return destination; }
    public String getMessageId() { return messageId; }
    public ErrorType getErrorType() { return errorType; }
    public String getErrorDetails() { return errorDetails; }

    public byte[] getOriginalBody() {
        return originalBody.clone();
    }

    @Override
    public String toString() {
        return "DeadLetterRecord{destination=" + destination
                + ", messageId=" + messageId
                + ", errorType=" + errorType
                + ", bodyLength=" + originalBody.length + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeadLetterRecord other)) return false;
        return destination.equals(other.destination)
                && Objects.equals(messageId, other.messageId)
                && Arrays.equals(originalBody, other.originalBody)
                && errorType == other.errorType
                && errorDetails.equals(other.errorDetails);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(destination, messageId, errorType, errorDetails) + Arrays.hashCode(originalBody);
    }
}
