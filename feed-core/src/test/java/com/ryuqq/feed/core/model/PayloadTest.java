package com.ryuqq.feed.core.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payload Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PayloadTest {

    @Test
    void of_Bytes_CopiesInput() {
        // Given
        byte[] raw = "{\"id\":\"g1\"}".getBytes(StandardCharsets.UTF_8);

        // When
        Payload payload = Payload.of(raw);
        raw[0] = 'X';

        // Then
        assertEquals("{\"id\":\"g1\"}", payload.asUtf8());
    }

    @Test
    void toByteArray_ReturnsCopy() {
        // Given
        Payload payload = Payload.ofUtf8("abc");

        // When
        byte[] bytes = payload.toByteArray();
        bytes[0] = 'z';

        // Then
        assertEquals("abc", payload.asUtf8());
    }

    @Test
    void empty_IsEmpty() {
        assertTrue(Payload.empty().isEmpty());
        assertEquals(0, Payload.empty().size());
    }

    @Test
    void equals_SameContent_ReturnsTrue() {
        assertEquals(Payload.ofUtf8("x"), Payload.of(new byte[] {'x'}));
        assertEquals(Payload.ofUtf8("x").hashCode(), Payload.of(new byte[] {'x'}).hashCode());
    }

    @Test
    void of_Null_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Payload.of(null));
        assertThrows(IllegalArgumentException.class, () -> Payload.ofUtf8(null));
    }
}
