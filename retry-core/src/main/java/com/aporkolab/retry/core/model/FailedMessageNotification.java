package com.aporkolab.retry.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * One failed-message notification handed to the retry controller.
 * 
 * Carries the raw body of the originally failed message plus whatever the
 * transport knows about where it came from (topic, partition, offset...).
 */
public final class FailedMessageNotification {

    private final String source;
    private final byte[] body;
    private final Map<String, String> attributes;

    public FailedMessageNotification(String source, byte[] body, Map<String, String> attributes) {
        this.source = source;
        this.body = body != null ? body.clone() : null;
        this.attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static FailedMessageNotification of(byte[] body) {
        return new FailedMessageNotification(null, body, Map.of());
    }

    public String getSource() { return source; }
    public Map<String, String> getAttributes() { return attributes; }

    public byte[] getBody() {
        return body != null ? body.clone() : null;
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    @Override
    public String toString() {
        return "FailedMessageNotification{source=" + source
                + ", bodyLength=" + (body != null ? body.length : -1)
                + ", attributes=" + attributes + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FailedMessageNotification other)) return false;
        return Objects.equals(source, other.source)
                && Arrays.equals(body, other.body)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(source, attributes) + Arrays.hashCode(body);
    }
}
