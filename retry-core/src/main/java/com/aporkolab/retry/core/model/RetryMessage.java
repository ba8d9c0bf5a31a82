package com.aporkolab.retry.core.model;

import java.util.Objects;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A failed message as seen by the retry core.
 * 
 * Only the metadata is interpreted. The {@code data} payload is kept as the exact
 * JSON text it arrived with, and fields the core does not know about (inside
 * {@code metadata} or at the top level) are carried through untouched.
 */
public final class RetryMessage {

    private final RetryMetadata metadata;
    private final String rawData;
    private final ObjectNode extraMetadata;
    private final ObjectNode extraFields;

    public RetryMessage(RetryMetadata metadata, String rawData, ObjectNode extraMetadata, ObjectNode extraFields) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.rawData = rawData;
        this.extraMetadata = extraMetadata != null ? extraMetadata.deepCopy() : JsonNodeFactory.instance.objectNode();
        this.extraFields = extraFields != null ? extraFields.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public static RetryMessage of(RetryMetadata metadata, String rawData) {
        return new RetryMessage(metadata, rawData, null, null);
    }

    public RetryMessage withMetadata(RetryMetadata updated) {
        return new RetryMessage(updated, rawData, extraMetadata, extraFields);
    }

    public RetryMetadata getMetadata() { return metadata; }
    public String getRawData() { return rawData; }
    public ObjectNode getExtraMetadata() { return extraMetadata.deepCopy(); }
    public ObjectNode getExtraFields() { return extraFields.deepCopy(); }

    public String getMessageId() {
        return metadata.messageId();
    }

    public boolean hasData() {
        return rawData != null;
    }

    @Override
    public String toString() {
        return "RetryMessage{messageId=" + metadata.messageId()
                + ", retryCount=" + metadata.retryCount()
                + ", nextRetryTime=" + metadata.nextRetryTime() + "}";
    }
}
