package com.aporkolab.retry.core.model;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.retry.core.exception.MalformedNotificationException;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reads and writes the JSON message envelope:
 * <pre>
 * {
 *   "metadata": {"message_id": "...", "retry_count": 2, "next_retry_time": "2026-10-19T10:15:30Z"},
 *   "data": { ... }
 * }
 * </pre>
 *
 * Design decisions:
 * - {@code data} is captured as its exact source text and written back raw
 * - Unknown fields survive a decode/encode cycle
 * - {@code retry_attempt} is accepted as a legacy spelling of {@code retry_count} on read only
 */
public class RetryMessageCodec {

    private static final Logger log = LoggerFactory.getLogger(RetryMessageCodec.class);

    public static final String METADATA = "metadata";
    public static final String DATA = "data";
    public static final String MESSAGE_ID = "message_id";
    public static final String RETRY_COUNT = "retry_count";
    public static final String LEGACY_RETRY_ATTEMPT = "retry_attempt";
    public static final String NEXT_RETRY_TIME = "next_retry_time";

    private final ObjectMapper objectMapper;

    public RetryMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public RetryMessage decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MalformedNotificationException("message body is empty");
        }
        // parsed from bytes so malformed UTF-8 is rejected instead of replaced
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new MalformedNotificationException("message body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedNotificationException("message body is not a JSON object");
        }

        JsonNode metadataNode = root.get(METADATA);
        if (metadataNode == null || !metadataNode.isObject()) {
            throw new MalformedNotificationException("message has no '" + METADATA + "' object");
        }

        RetryMetadata metadata = new RetryMetadata(
                readMessageId(metadataNode),
                readRetryCount(metadataNode),
                readNextRetryTime(metadataNode));

        ObjectNode extraMetadata = ((ObjectNode) metadataNode).deepCopy();
        extraMetadata.remove(MESSAGE_ID);
        extraMetadata.remove(RETRY_COUNT);
        extraMetadata.remove(LEGACY_RETRY_ATTEMPT);
        extraMetadata.remove(NEXT_RETRY_TIME);

        ObjectNode extraFields = ((ObjectNode) root).deepCopy();
        extraFields.remove(METADATA);
        extraFields.remove(DATA);

        String rawData = root.has(DATA) ? extractRawField(body, DATA) : null;

        return new RetryMessage(metadata, rawData, extraMetadata, extraFields);
    }

    public byte[] encode(RetryMessage message) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator gen = objectMapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            RetryMetadata metadata = message.getMetadata();

            gen.writeStartObject();
            gen.writeFieldName(METADATA);
            gen.writeStartObject();
            if (metadata.messageId() != null) {
                gen.writeStringField(MESSAGE_ID, metadata.messageId());
            }
            gen.writeNumberField(RETRY_COUNT, metadata.retryCount());
            if (metadata.nextRetryTime() != null) {
                gen.writeStringField(NEXT_RETRY_TIME, formatInstant(metadata.nextRetryTime()));
            }
            writeFields(gen, message.getExtraMetadata());
            gen.writeEndObject();

            if (message.hasData()) {
                gen.writeFieldName(DATA);
                gen.writeRawValue(message.getRawData());
            }
            writeFields(gen, message.getExtraFields());
            gen.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize message " + message.getMessageId(), e);
        }
        return out.toByteArray();
    }

    public String encodeToString(RetryMessage message) {
        return new String(encode(message), StandardCharsets.UTF_8);
    }

    public static String formatInstant(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    private void writeFields(JsonGenerator gen, ObjectNode fields) throws IOException {
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            gen.writeFieldName(field.getKey());
            objectMapper.writeTree(gen, field.getValue());
        }
    }

    private String readMessageId(JsonNode metadata) {
        JsonNode id = metadata.get(MESSAGE_ID);
        if (id == null || id.isNull()) {
            return null;
        }
        return id.isValueNode() ? id.asText() : id.toString();
    }

    private int readRetryCount(JsonNode metadata) {
        JsonNode count = metadata.has(RETRY_COUNT) ? metadata.get(RETRY_COUNT) : metadata.get(LEGACY_RETRY_ATTEMPT);
        if (count == null || count.isNull()) {
            return 0;
        }
        if (!count.isIntegralNumber() || !count.canConvertToInt() || count.intValue() < 0) {
            throw new MalformedNotificationException("'" + RETRY_COUNT + "' must be a non-negative integer, was " + count);
        }
        return count.intValue();
    }

    private Instant readNextRetryTime(JsonNode metadata) {
        JsonNode time = metadata.get(NEXT_RETRY_TIME);
        if (time == null || time.isNull()) {
            return null;
        }
        try {
            return Instant.parse(time.asText());
        } catch (DateTimeParseException e) {
            // overwritten on the next schedule anyway
            log.warn("Ignoring unparseable {} '{}': {}", NEXT_RETRY_TIME, time.asText(), e.getMessage());
            return null;
        }
    }

    /**
     * Returns the exact source text of a top-level field value.
     * For a repeated field the last occurrence wins, as it does in {@code readTree}.
     */
    private String extractRawField(byte[] body, String fieldName) {
        try (JsonParser parser = objectMapper.getFactory().createParser(body)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return null;
            }
            String raw = null;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String name = parser.currentName();
                JsonToken value = parser.nextToken();
                if (fieldName.equals(name)) {
                    int start = (int) parser.currentTokenLocation().getByteOffset();
                    if (value == JsonToken.VALUE_STRING) {
                        parser.getText();
                    }
                    parser.skipChildren();
                    int end = (int) parser.currentLocation().getByteOffset();
                    if (start < 0 || end < start) {
                        throw new MalformedNotificationException("message body is not UTF-8 encoded");
                    }
                    raw = new String(body, start, end - start, StandardCharsets.UTF_8);
                } else {
                    parser.skipChildren();
                }
            }
            return raw;
        } catch (IOException e) {
            throw new MalformedNotificationException("cannot read '" + fieldName + "'", e);
        }
    }
}
