package com.acme.secops.iamdrift.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonCodecTest {

    @Test
    void shouldReadOptionalFieldsWithFallbacks() throws Exception {
        JsonNode node = JsonCodec.readTree("""
            {"name": "  ops ", "blank": " ", "nested": {}, "count": "12", "bad": "x", "flag": "yes", "on": true}
            """);

        assertEquals("ops", JsonCodec.optionalText(node, "name", null));
        assertEquals("fb", JsonCodec.optionalText(node, "blank", "fb"));
        assertEquals("fb", JsonCodec.optionalText(node, "nested", "fb"));
        assertNull(JsonCodec.optionalText(null, "name", null));
        assertEquals(12, JsonCodec.optionalInt(node, "count", -1));
        assertEquals(-1, JsonCodec.optionalInt(node, "bad", -1));
        assertTrue(JsonCodec.optionalBoolean(node, "flag", false));
        assertTrue(JsonCodec.optionalBoolean(node, "on", false));
        assertFalse(JsonCodec.optionalBoolean(node, "missing", false));
    }

    @Test
    void shouldRejectMissingRequiredText() throws Exception {
        JsonNode node = JsonCodec.readTree("{\"id\": \"\"}");
        assertThrows(IllegalArgumentException.class, () -> JsonCodec.requiredText(node, "id"));
    }
}
