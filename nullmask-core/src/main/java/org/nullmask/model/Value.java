package org.nullmask.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A single cell value. The null marker is a distinguished singleton ({@link #nullValue()}),
 * not the absence of a key.
 *
 * - raw: the value as read from the source, kept untouched so writers can emit it unchanged
 * - canonicalText: a stable, locale-independent rendering used for pattern matching
 */
public final class Value {

    public enum Kind { TEXT, NUMBER, BOOLEAN, NULL, OPAQUE }

    private static final Value NULL = new Value(Kind.NULL, null);
    private static final Value TRUE = new Value(Kind.BOOLEAN, Boolean.TRUE);
    private static final Value FALSE = new Value(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object raw;

    private Value(Kind kind, Object raw) {
        this.kind = kind;
        this.raw = raw;
    }

    public static Value nullValue() {
        return NULL;
    }

    public static Value text(String text) {
        return new Value(Kind.TEXT, Objects.requireNonNull(text, "text must not be null"));
    }

    public static Value number(Number number) {
        return new Value(Kind.NUMBER, Objects.requireNonNull(number, "number must not be null"));
    }

    public static Value bool(boolean flag) {
        return flag ? TRUE : FALSE;
    }

    public static Value opaque(Object raw) {
        return new Value(Kind.OPAQUE, Objects.requireNonNull(raw, "raw must not be null"));
    }

    /**
     * Wraps an arbitrary Java object, picking the kind from its runtime type.
     * A Java {@code null} becomes the null marker.
     */
    public static Value of(Object raw) {
        if (raw == null) return NULL;
        if (raw instanceof Value v) return v;
        if (raw instanceof String s) return text(s);
        if (raw instanceof Number n) return number(n);
        if (raw instanceof Boolean b) return bool(b);
        return opaque(raw);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /** The wrapped object, or {@code null} for the null marker. */
    public Object raw() {
        return raw;
    }

    /**
     * Textual form used for matching. Numbers and booleans never depend on the default locale.
     * The null marker has no text and renders as an empty string.
     */
    public String canonicalText() {
        return switch (kind) {
            case NULL -> "";
            case TEXT -> (String) raw;
            case BOOLEAN -> ((Boolean) raw) ? "true" : "false";
            case NUMBER -> canonicalNumber((Number) raw);
            case OPAQUE -> String.valueOf(raw);
        };
    }

    private static String canonicalNumber(Number n) {
        if (n instanceof BigDecimal d) return d.toPlainString();
        if (n instanceof BigInteger i) return i.toString();
        if (n instanceof Double d) return Double.toString(d);
        if (n instanceof Float f) return Float.toString(f);
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return Long.toString(n.longValue());
        }
        return n.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Value that)) return false;
        return kind == that.kind && Objects.equals(raw, that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, raw);
    }

    @Override
    public String toString() {
        return isNull() ? "null" : kind + "(" + canonicalText() + ")";
    }
}
