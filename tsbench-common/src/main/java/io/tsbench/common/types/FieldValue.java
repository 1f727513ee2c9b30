package io.tsbench.common.types;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Tag or field value. The kind is explicit so serializers switch on it instead of
 * inspecting the runtime class of the payload.
 */
public final class FieldValue {

    public enum Kind {
        INTEGER,
        FLOAT,
        BOOLEAN,
        TEXT,
        BYTES
    }

    private final Kind kind;
    private final long longValue;
    private final double doubleValue;
    private final Object reference;

    private FieldValue(Kind kind, long longValue, double doubleValue, Object reference) {
        this.kind = kind;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.reference = reference;
    }

    public static FieldValue ofLong(long value) {
        return new FieldValue(Kind.INTEGER, value, 0, null);
    }

    public static FieldValue ofDouble(double value) {
        return new FieldValue(Kind.FLOAT, 0, value, null);
    }

    public static FieldValue ofBoolean(boolean value) {
        return new FieldValue(Kind.BOOLEAN, value ? 1 : 0, 0, null);
    }

    public static FieldValue ofText(String value) {
        return new FieldValue(Kind.TEXT, 0, 0, Objects.requireNonNull(value));
    }

    public static FieldValue ofBytes(byte[] value) {
        return new FieldValue(Kind.BYTES, 0, 0, value.clone());
    }

    public Kind kind() {
        return kind;
    }

    public long asLong() {
        expect(Kind.INTEGER);
        return longValue;
    }

    public double asDouble() {
        expect(Kind.FLOAT);
        return doubleValue;
    }

    public boolean asBoolean() {
        expect(Kind.BOOLEAN);
        return longValue != 0;
    }

    public String asText() {
        expect(Kind.TEXT);
        return (String) reference;
    }

    public byte[] asBytes() {
        expect(Kind.BYTES);
        return ((byte[]) reference).clone();
    }

    /**
     * Plain textual rendering: shortest round-trip form for floats, raw content for text and bytes.
     */
    public String format() {
        return switch (kind) {
            case INTEGER -> Long.toString(longValue);
            case FLOAT -> formatDouble(doubleValue);
            case BOOLEAN -> Boolean.toString(longValue != 0);
            case TEXT -> (String) reference;
            case BYTES -> new String((byte[]) reference, StandardCharsets.UTF_8);
        };
    }

    static String formatDouble(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private void expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("value is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue)) return false;
        FieldValue that = (FieldValue) o;
        if (kind != that.kind) return false;
        return switch (kind) {
            case INTEGER, BOOLEAN -> longValue == that.longValue;
            case FLOAT -> Double.compare(doubleValue, that.doubleValue) == 0;
            case TEXT -> reference.equals(that.reference);
            case BYTES -> Arrays.equals((byte[]) reference, (byte[]) that.reference);
        };
    }

    @Override
    public int hashCode() {
        return switch (kind) {
            case INTEGER, BOOLEAN -> Objects.hash(kind, longValue);
            case FLOAT -> Objects.hash(kind, doubleValue);
            case TEXT -> Objects.hash(kind, reference);
            case BYTES -> 31 * kind.hashCode() + Arrays.hashCode((byte[]) reference);
        };
    }

    @Override
    public String toString() {
        return kind + "(" + format() + ")";
    }
}
