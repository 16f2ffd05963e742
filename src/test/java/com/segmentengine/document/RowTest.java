package com.segmentengine.document;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RowTest {

    @Test
    void testFieldsAreCopied() {
        Map<String, String> fields = new HashMap<>();
        fields.put("body", "text");
        Row row = new Row(1L, "k", fields);

        fields.put("body", "changed");

        assertEquals("text", row.fields().get("body"));
        assertThrows(UnsupportedOperationException.class, () -> row.fields().put("x", "y"));
    }

    @Test
    void testRequireKey() {
        assertDoesNotThrow(() -> Row.of(1L, "k", "body").requireKey());
        assertThrows(IllegalArgumentException.class, () -> new Row(1L, null, Map.of()).requireKey());
        assertThrows(IllegalArgumentException.class, () -> new Row(1L, " ", Map.of()).requireKey());
    }
}
