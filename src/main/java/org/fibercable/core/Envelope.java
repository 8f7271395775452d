package org.fibercable.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Inbound command frame: {"command":..., "identifier":..., "data":{...}}.
 */
public class Envelope {

    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";
    public static final String MESSAGE = "message";

    private final String command;
    private final String identifier;
    private final ObjectNode data;

    public Envelope(String command, String identifier, ObjectNode data) {
        this.command = command;
        this.identifier = identifier;
        this.data = data;
    }

    public static Envelope parse(String json) {
        JsonNode root = Json.decode(json);
        if (!root.isObject()) {
            throw new ProtocolException("Expected an object but got " + json);
        }
        JsonNode identifier = root.get("identifier");
        if (identifier == null || identifier.isNull()) {
            throw new ProtocolException("Missing identifier in " + json);
        }
        JsonNode command = root.get("command");
        return new Envelope(command == null ? null : command.asText(), textOf(identifier), dataOf(root.get("data")));
    }

    private static String textOf(JsonNode identifier) {
        return identifier.isTextual() ? identifier.asText() : identifier.toString();
    }

    // data may arrive as an object or as a string holding one
    private static ObjectNode dataOf(JsonNode data) {
        if (data == null || data.isNull()) {
            return Json.object();
        }
        if (data.isTextual()) {
            JsonNode decoded = Json.decode(data.asText());
            if (decoded.isObject()) {
                return (ObjectNode) decoded;
            }
            throw new ProtocolException("data must be an object: " + data);
        }
        if (data.isObject()) {
            return (ObjectNode) data;
        }
        throw new ProtocolException("data must be an object: " + data);
    }

    public String getCommand() {
        return command;
    }

    public String getIdentifier() {
        return identifier;
    }

    public ObjectNode getData() {
        return data;
    }

    @Override
    public String toString() {
        return "Envelope{" +
                "command='" + command + '\'' +
                ", identifier='" + identifier + '\'' +
                ", data=" + data +
                '}';
    }
}
