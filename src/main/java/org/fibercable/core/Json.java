package org.fibercable.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared codec for the wire format. {@link ObjectMapper} is thread safe once configured.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    public static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to encode " + value, e);
        }
    }

    public static JsonNode decode(String json) {
        if (json == null) {
            throw new ProtocolException("null payload");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON: " + json, e);
        }
    }

    /**
     * Wraps a payload for one subscriber: {"identifier":..., "message":...}.
     */
    public static String envelope(String identifier, Object message) {
        ObjectNode node = object();
        node.put("identifier", identifier);
        node.set("message", MAPPER.valueToTree(message));
        return encode(node);
    }
}
