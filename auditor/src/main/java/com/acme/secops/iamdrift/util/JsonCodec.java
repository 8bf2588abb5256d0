package com.acme.secops.iamdrift.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared JSON codec for snapshot input and report output.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    public static String optionalText(JsonNode node, String field, String fallback) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) {
            return fallback;
        }
        String text = v.asText();
        return text.isBlank() ? fallback : text.trim();
    }

    public static String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field, null);
        if (value == null) {
            throw new IllegalArgumentException("missing required text field: " + field);
        }
        return value;
    }

    public static boolean optionalBoolean(JsonNode node, String field, boolean fallback) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) {
            return fallback;
        }
        if (v.isBoolean()) {
            return v.asBoolean();
        }
        return v.isTextual() ? EnvVars.parseBoolean(v.asText(), fallback) : fallback;
    }

    /** @return the integer value, or {@code fallback} when absent, non-numeric or malformed */
    public static int optionalInt(JsonNode node, String field, int fallback) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) {
            return fallback;
        }
        if (v.isNumber()) {
            return v.asInt();
        }
        if (v.isTextual()) {
            try {
                return Integer.parseInt(v.asText().trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }
}
