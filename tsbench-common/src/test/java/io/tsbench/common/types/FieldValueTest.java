package io.tsbench.common.types;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FieldValueTest {

    @Test
    void format() {
        assertEquals("-42", FieldValue.ofLong(-42).format());
        assertEquals("58", FieldValue.ofDouble(58.0).format());
        assertEquals("58.25", FieldValue.ofDouble(58.25).format());
        assertEquals("true", FieldValue.ofBoolean(true).format());
        assertEquals("host_0", FieldValue.ofText("host_0").format());
        assertEquals("abc", FieldValue.ofBytes("abc".getBytes(StandardCharsets.UTF_8)).format());
    }

    @Test
    void accessors() {
        var value = FieldValue.ofLong(7);
        assertEquals(FieldValue.Kind.INTEGER, value.kind());
        assertEquals(7, value.asLong());
        assertThrows(IllegalStateException.class, value::asDouble);
        assertThrows(IllegalStateException.class, () -> FieldValue.ofBoolean(false).asText());
    }

    @Test
    void equality() {
        assertEquals(FieldValue.ofDouble(1.5), FieldValue.ofDouble(1.5));
        assertNotEquals(FieldValue.ofLong(1), FieldValue.ofBoolean(true));
        assertNotEquals(FieldValue.ofLong(1), FieldValue.ofDouble(1));
        assertEquals(FieldValue.ofBytes(new byte[]{1, 2}), FieldValue.ofBytes(new byte[]{1, 2}));
        assertEquals(FieldValue.ofBytes(new byte[]{1, 2}).hashCode(), FieldValue.ofBytes(new byte[]{1, 2}).hashCode());
    }

    @Test
    void bytesAreCopied() {
        var raw = new byte[]{1, 2, 3};
        var value = FieldValue.ofBytes(raw);
        raw[0] = 9;
        value.asBytes()[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, value.asBytes());
    }
}
