package com.nova.script.parser;

import java.util.Objects;

/**
 * Dynamically typed Nova value: number (integer or float), text, boolean or unset.
 */
public final class Value {
    public enum Type { NUMBER, TEXT, BOOLEAN, UNSET }

    private static final Value UNSET = new Value(Type.UNSET, null);
    private static final Value TRUE = new Value(Type.BOOLEAN, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOLEAN, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.NUMBER, l); }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value text(String s) { return new Value(Type.TEXT, s); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value unset() { return UNSET; }

    /** Wraps a literal produced by the lexer (Long, Double or String). */
    static Value ofLiteral(Object literal) {
        if (literal instanceof Long) return integer((Long) literal);
        if (literal instanceof Double) return number((Double) literal);
        if (literal instanceof String) return text((String) literal);
        throw new IllegalArgumentException("Unsupported literal: " + literal);
    }

    public Type getType() { return type; }

    public boolean isInteger() {
        return type == Type.NUMBER && value instanceof Long;
    }

    public long asLong() {
        if (!isInteger()) throw new IllegalStateException("Expected integer, got " + describe());
        return (Long) value;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + describe());
        return ((Number) value).doubleValue();
    }

    public boolean asBool() {
        if (type != Type.BOOLEAN) throw new IllegalStateException("Expected boolean, got " + describe());
        return (Boolean) value;
    }

    public String asText() {
        if (type != Type.TEXT) throw new IllegalStateException("Expected text, got " + describe());
        return (String) value;
    }

    /** Everything is truthy except {@code false}, numeric zero and unset. */
    public boolean isTruthy() {
        switch (type) {
            case UNSET:
                return false;
            case BOOLEAN:
                return (Boolean) value;
            case NUMBER:
                return asNumber() != 0.0;
            default:
                return true;
        }
    }

    String describe() {
        return type.name().toLowerCase() + (type == Type.UNSET ? "" : " " + this);
    }

    /** Textual form used by {@code put}. */
    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return isInteger() ? Long.toString(asLong()) : Double.toString(asNumber());
            case BOOLEAN:
                return Boolean.toString(asBool());
            case TEXT:
                return asText();
            default:
                return "unset";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.NUMBER) {
            if (isInteger() && other.isInteger()) return asLong() == other.asLong();
            return asNumber() == other.asNumber();
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER) return Double.hashCode(asNumber());
        return Objects.hash(type, value);
    }
}
