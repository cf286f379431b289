package com.avari.signaling.signaling;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire format of every text frame: an event name plus its JSON payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SignalingEnvelope(String event, JsonNode data) {

    /**
     * Reads a string field of the payload, or {@code null} when absent.
     */
    public String text(String field) {
        if (data == null) {
            return null;
        }
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * Reads a field of the payload as an opaque JSON value.
     */
    public JsonNode node(String field) {
        return data == null ? null : data.get(field);
    }
}
