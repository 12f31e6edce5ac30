package com.rapcode.script.parser;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;

/** Runtime value: a number (double), a boolean or a string. There is no null value. */
public final class Value {
    public enum Type { NUMBER, BOOL, STRING }

    public static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    // Plain decimal text only: no hex, exponent or type suffix.
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }

    /**
     * Coerces a line of external input: a numeric text becomes a number,
     * anything else stays a string.
     */
    public static Value fromInput(String text) {
        String s = (text == null) ? "" : text;
        String trimmed = s.trim();
        if (DECIMAL.matcher(trimmed).matches()) {
            double d = Double.parseDouble(trimmed);
            if (!Double.isInfinite(d)) return number(d);
        }
        return string(s);
    }

    public Type getType() { return type; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (Double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** Boolean is itself, a number is true iff nonzero, a string is true iff nonempty. */
    public boolean isTruthy() {
        switch (type) {
            case BOOL: return asBool();
            case NUMBER: return asNumber() != 0.0;
            case STRING: return !asString().isEmpty();
            default: return false;
        }
    }

    /** The text OUTPUT prints and string concatenation uses. */
    public String display() {
        switch (type) {
            case NUMBER: return formatNumber(asNumber());
            case BOOL: return asBool() ? "TRUE" : "FALSE";
            default: return asString();
        }
    }

    /**
     * Plain decimal notation, never an exponent, so the text lexes back as the same number.
     * Integral numbers render without a fractional part.
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL: return "boolean";
            default: return "string";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.NUMBER) return asNumber() == other.asNumber();
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER) {
            double d = asNumber();
            return Objects.hash(type, d == 0.0 ? 0.0 : d);
        }
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type == Type.STRING ? '"' + asString() + '"' : display();
    }
}
