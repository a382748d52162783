package com.ryuqq.dualwrite.core.validation;

import com.ryuqq.dualwrite.core.model.EntityType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ParityFieldRegistry, EntityParitySpec 테스트.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class ParityFieldRegistryTest {

    @Test
    void builder_DefaultsToHalfCentTolerance() {
        EntityParitySpec spec = EntityParitySpec.builder("product")
            .field("name")
            .field("price", "unit_price")
            .build();

        assertEquals(new BigDecimal("0.005"), spec.getNumericTolerance());
        assertFalse(spec.getFields().get(0).isRenamed());
        assertTrue(spec.getFields().get(1).isRenamed());
        assertEquals("unit_price", spec.getFields().get(1).secondaryName());
    }

    @Test
    void builder_NoFields_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> EntityParitySpec.builder("product").build()
        );
        assertTrue(exception.getMessage().contains("At least one parity field"));
    }

    @Test
    void builder_DuplicateField_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> EntityParitySpec.builder("product").field("name").field("name", "title").build());
    }

    @Test
    void builder_NegativeTolerance_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> EntityParitySpec.builder("product").field("name").numericTolerance(new BigDecimal("-1")).build());
    }

    @Test
    void register_SameTypeTwice_ThrowsException() {
        ParityFieldRegistry registry = new ParityFieldRegistry()
            .register(EntityParitySpec.builder("product").field("name").build());

        assertThrows(IllegalArgumentException.class,
            () -> registry.register(EntityParitySpec.builder("product").field("price").build()));
    }

    @Test
    void require_UnknownType_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ParityFieldRegistry().require(EntityType.of("cart"))
        );
        assertTrue(exception.getMessage().contains("No parity fields registered"));
    }

    @Test
    void registeredTypes_SortedByName() {
        ParityFieldRegistry registry = new ParityFieldRegistry()
            .register(EntityParitySpec.builder("product").field("name").build())
            .register(EntityParitySpec.builder("cart").field("items").build());

        assertEquals(List.of(EntityType.of("cart"), EntityType.of("product")), List.copyOf(registry.registeredTypes()));
        assertTrue(registry.find(EntityType.of("order")).isEmpty());
    }
}
