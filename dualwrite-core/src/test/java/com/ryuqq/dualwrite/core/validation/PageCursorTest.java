package com.ryuqq.dualwrite.core.validation;

import com.ryuqq.dualwrite.core.model.EntityKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PageCursor 인코딩 테스트.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class PageCursorTest {

    @Test
    void start_IsPrimaryWithoutKey() {
        PageCursor cursor = PageCursor.start();

        assertEquals(ScanPhase.PRIMARY, cursor.phase());
        assertNull(cursor.afterKey());
        assertEquals("P:", cursor.encode());
    }

    @Test
    void decode_NullOrEmpty_ReturnsStart() {
        assertEquals(PageCursor.start(), PageCursor.decode(null));
        assertEquals(PageCursor.start(), PageCursor.decode(""));
    }

    @Test
    void decode_KeyContainingSeparator_KeepsWholeKey() {
        PageCursor cursor = PageCursor.decode("S:tenant:42");

        assertEquals(ScanPhase.SECONDARY, cursor.phase());
        assertEquals(EntityKey.of("tenant:42"), cursor.afterKey());
        assertEquals("S:tenant:42", cursor.encode());
    }

    @Test
    void decode_UnknownPhase_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> PageCursor.decode("X:k1")
        );
        assertTrue(exception.getMessage().contains("Unknown scan phase"));
    }

    @Test
    void decode_MissingSeparator_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> PageCursor.decode("PRIMARY"));
    }
}
