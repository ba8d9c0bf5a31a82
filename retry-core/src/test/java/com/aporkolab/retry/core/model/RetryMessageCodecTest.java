package com.aporkolab.retry.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.aporkolab.retry.core.exception.MalformedNotificationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class RetryMessageCodecTest {

    private static final String MESSAGE_ID = "8f14e45f-ceea-467a-9af0-5c1d2b3e4f60";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RetryMessageCodec codec = new RetryMessageCodec(objectMapper);

    @Nested
    @DisplayName("Decode")
    class Decode {

        @Test
        @DisplayName("should default retry count to zero when absent")
        void shouldDefaultRetryCount() {
            RetryMessage message = codec.decode(bytes(
                    "{\"metadata\":{\"message_id\":\"" + MESSAGE_ID + "\"},\"data\":{}}"));

            assertThat(message.getMetadata().retryCount()).isZero();
            assertThat(message.getMetadata().nextRetryTime()).isNull();
            assertThat(message.getMessageId()).isEqualTo(MESSAGE_ID);
        }

        @Test
        @DisplayName("should read retry count and next retry time")
        void shouldReadMetadata() {
            RetryMessage message = codec.decode(bytes(
                    "{\"metadata\":{\"message_id\":\"a\",\"retry_count\":3,"
                            + "\"next_retry_time\":\"2026-10-19T10:15:30Z\"},\"data\":{}}"));

            assertThat(message.getMetadata().retryCount()).isEqualTo(3);
            assertThat(message.getMetadata().nextRetryTime()).isEqualTo(Instant.parse("2026-10-19T10:15:30Z"));
        }

        @Test
        @DisplayName("should accept legacy retry_attempt spelling")
        void shouldAcceptLegacyField() {
            RetryMessage message = codec.decode(bytes(
                    "{\"metadata\":{\"message_id\":\"a\",\"retry_attempt\":2},\"data\":{}}"));

            assertThat(message.getMetadata().retryCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should capture data as its exact source text")
        void shouldCaptureRawData() {
            String data = "{ \"amount\" : 10.50,\n  \"items\": [1, 2,3], \"note\": \"caf\u00e9 \\u00e9\" }";
            RetryMessage message = codec.decode(bytes(
                    "{\"metadata\": {\"message_id\": \"a\"}, \"data\": " + data + "}"));

            assertThat(message.getRawData()).isEqualTo(data);
        }

        @Test
        @DisplayName("should capture scalar data values")
        void shouldCaptureScalarData() {
            RetryMessage message = codec.decode(bytes(
                    "{\"data\": \"plain text\", \"metadata\": {\"message_id\": \"a\"}}"));

            assertThat(message.getRawData()).isEqualTo("\"plain text\"");
        }

        @Test
        @DisplayName("should fail on invalid JSON")
        void shouldFailOnInvalidJson() {
            assertThatThrownBy(() -> codec.decode(bytes("not json")))
                    .isInstanceOf(MalformedNotificationException.class)
                    .hasMessageContaining("not valid JSON");
        }

        @Test
        @DisplayName("should fail when body is not an object")
        void shouldFailOnNonObject() {
            assertThatThrownBy(() -> codec.decode(bytes("[1,2,3]")))
                    .isInstanceOf(MalformedNotificationException.class);
        }

        @Test
        @DisplayName("should fail without metadata object")
        void shouldFailWithoutMetadata() {
            assertThatThrownBy(() -> codec.decode(bytes("{\"data\":{}}")))
                    .isInstanceOf(MalformedNotificationException.class)
                    .hasMessageContaining("metadata");
        }

        @Test
        @DisplayName("should fail on negative or non-integer retry count")
        void shouldFailOnBadRetryCount() {
            assertThatThrownBy(() -> codec.decode(bytes("{\"metadata\":{\"retry_count\":-1}}")))
                    .isInstanceOf(MalformedNotificationException.class);
            assertThatThrownBy(() -> codec.decode(bytes("{\"metadata\":{\"retry_count\":\"two\"}}")))
                    .isInstanceOf(MalformedNotificationException.class);
        }

        @Test
        @DisplayName("should fail on empty body")
        void shouldFailOnEmptyBody() {
            assertThatThrownBy(() -> codec.decode(new byte[0]))
                    .isInstanceOf(MalformedNotificationException.class);
        }

        @Test
        @DisplayName("should ignore an unparseable next retry time")
        void shouldIgnoreBadNextRetryTime() {
            RetryMessage message = codec.decode(bytes(
                    "{\"metadata\":{\"message_id\":\"a\",\"next_retry_time\":\"yesterday\"},\"data\":{}}"));

            assertThat(message.getMetadata().nextRetryTime()).isNull();
        }

        @Test
        @DisplayName("should reject a body that is not valid UTF-8")
        void shouldRejectInvalidUtf8() {
            byte[] prefix = bytes("{\"metadata\":{\"message_id\":\"a\"},\"data\":{\"k\":\"");
            byte[] suffix = bytes("\"}}");
            byte[] body = new byte[prefix.length + 1 + suffix.length];
            System.arraycopy(prefix, 0, body, 0, prefix.length);
            body[prefix.length] = (byte) 0xFF;
            System.arraycopy(suffix, 0, body, prefix.length + 1, suffix.length);

            assertThatThrownBy(() -> codec.decode(body))
                    .isInstanceOf(MalformedNotificationException.class);
        }

        @Test
        @DisplayName("should keep multi-byte characters in data unchanged")
        void shouldKeepMultiByteData() {
            String data = "{\"city\": \"Győr\", \"note\": \"€ ✓\"}";
            RetryMessage message = codec.decode(bytes(
                    "{\"metadata\":{\"message_id\":\"ő\"},\"data\":" + data + ",\"tail\":1}"));

            assertThat(message.getRawData()).isEqualTo(data);
            assertThat(message.getMetadata().messageId()).isEqualTo("ő");
        }

        @Test
        @DisplayName("should take the last data value when the field is repeated")
        void shouldTakeLastRepeatedData() {
            RetryMessage message = codec.decode(bytes(
                    "{\"metadata\":{\"message_id\":\"a\"},\"data\":{\"v\":1},\"data\":{\"v\": 2}}"));

            assertThat(message.getRawData()).isEqualTo("{\"v\": 2}");
        }
    }

    @Nested
    @DisplayName("Encode")
    class Encode {

        @Test
        @DisplayName("should write canonical retry_count and drop the legacy field")
        void shouldWriteCanonicalField() throws Exception {
            RetryMessage message = codec.decode(bytes(
                    "{\"metadata\":{\"message_id\":\"a\",\"retry_attempt\":2},\"data\":{}}"));

            JsonNode written = objectMapper.readTree(codec.encode(message.withMetadata(message.getMetadata().increment())));

            assertThat(written.at("/metadata/retry_count").asInt()).isEqualTo(3);
            assertThat(written.at("/metadata").has("retry_attempt")).isFalse();
        }

        @Test
        @DisplayName("should write next retry time with second precision")
        void shouldWriteNextRetryTime() throws Exception {
            RetryMessage message = RetryMessage.of(
                    new RetryMetadata("a", 1, Instant.parse("2026-10-19T10:15:30.500Z")), "{}");

            JsonNode written = objectMapper.readTree(codec.encode(message));

            assertThat(written.at("/metadata/next_retry_time").asText()).isEqualTo("2026-10-19T10:15:30Z");
        }

        @Test
        @DisplayName("should keep data text and unknown fields unchanged")
        void shouldPreserveDataAndUnknownFields() throws Exception {
            String data = "{\"b\": 2,   \"a\": [ true, null ]}";
            String body = "{\"metadata\":{\"message_id\":\"" + MESSAGE_ID + "\",\"source\":\"orders\"},"
                    + "\"data\":" + data + ",\"trace\":{\"id\":7}}";

            String encoded = codec.encodeToString(codec.decode(bytes(body)));

            assertThat(encoded).contains("\"data\":" + data);
            JsonNode written = objectMapper.readTree(encoded);
            assertThat(written.at("/metadata/message_id").asText()).isEqualTo(MESSAGE_ID);
            assertThat(written.at("/metadata/source").asText()).isEqualTo("orders");
            assertThat(written.at("/trace/id").asInt()).isEqualTo(7);
        }

        @Test
        @DisplayName("should omit data when the message had none")
        void shouldOmitMissingData() throws Exception {
            RetryMessage message = codec.decode(bytes("{\"metadata\":{\"message_id\":\"a\"}}"));

            JsonNode written = objectMapper.readTree(codec.encode(message));

            assertThat(written.has("data")).isFalse();
        }
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
