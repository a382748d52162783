package com.ryuqq.dualwrite.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payload 테스트.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class PayloadTest {

    @Test
    void builder_PreservesFieldOrder() {
        Payload payload = Payload.builder()
            .put("name", "Kettle")
            .put("price", 19.99)
            .put("stock", 3)
            .build();

        assertEquals(List.of("name", "price", "stock"), List.copyOf(payload.getFields().keySet()));
    }

    @Test
    void of_CopiesSourceMap() {
        // Given
        Map<String, Object> source = new HashMap<>();
        source.put("name", "Kettle");

        // When
        Payload payload = Payload.of(source);
        source.put("name", "Changed");

        // Then
        assertEquals("Kettle", payload.get("name"));
    }

    @Test
    void getFields_IsUnmodifiable() {
        Payload payload = Payload.builder().put("name", "Kettle").build();

        assertThrows(UnsupportedOperationException.class, () -> payload.getFields().put("x", 1));
    }

    @Test
    void nullValue_IsKeptAsPresentField() {
        Payload payload = Payload.builder().put("note", null).build();

        assertTrue(payload.contains("note"));
        assertNull(payload.get("note"));
        assertFalse(payload.isEmpty());
    }

    @Test
    void of_NullMap_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Payload.of(null));
    }

    @Test
    void builder_NullFieldName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Payload.builder().put(null, "x"));
    }

    @Test
    void equals_ComparesFieldMaps() {
        Payload a = Payload.builder().put("name", "Kettle").build();
        Payload b = Payload.of(Map.of("name", "Kettle"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
