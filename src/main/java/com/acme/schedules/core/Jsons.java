package com.acme.schedules.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Map;

/**
 * Payload conversions. Payloads are opaque JSON trees; nothing here inspects them.
 */
public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper();

    private Jsons() {}

    public static String toJson(JsonNode node) {
        try {
            return M.writeValueAsString(node == null ? NullNode.getInstance() : node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    /** Parses stored JSON text; SQL NULL and the JSON literal {@code null} both map to {@link NullNode}. */
    public static JsonNode fromJson(String json) {
        if (json == null) {
            return NullNode.getInstance();
        }
        try {
            return M.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored payload is not valid JSON", e);
        }
    }

    public static JsonNode valueOf(Object value) {
        return M.valueToTree(value);
    }

    public static JsonNode of(String k, Object v) {
        return valueOf(Map.of(k, v));
    }
}
