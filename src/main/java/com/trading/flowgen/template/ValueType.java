package com.trading.flowgen.template;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * Declared type of a template parameter.
 */
public enum ValueType {
    INTEGER("integer"),
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean");

    private final String jsonName;

    ValueType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    /**
     * Whether {@code value} is acceptable for this type.
     * Booleans never count as numbers. Integers accept only integral types:
     * decimals such as {@code 20.0} or {@code 1e2} are floating-point values.
     */
    public boolean accepts(Object value) {
        if (value == null)
            return false;
        return switch (this) {
            case INTEGER -> isIntegral(value);
            case NUMBER -> value instanceof Number n && isFinite(n);
            case STRING -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
        };
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float)
            return Double.isFinite(n.doubleValue());
        return true;
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Boolean)
            return false;
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    public static ValueType fromString(String text) {
        if (text != null) {
            for (ValueType t : values()) {
                if (t.jsonName.equalsIgnoreCase(text.trim())) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown parameter type: " + text);
    }

    /** JSON-style kind name of an arbitrary value, for error messages. */
    public static String describe(Object value) {
        if (value == null)
            return "null";
        if (value instanceof Boolean)
            return "boolean";
        if (INTEGER.accepts(value))
            return "integer";
        if (value instanceof Number)
            return "number";
        if (value instanceof CharSequence)
            return "string";
        if (value instanceof Collection<?> || value.getClass().isArray())
            return "array";
        if (value instanceof Map<?, ?>)
            return "object";
        return value.getClass().getSimpleName();
    }
}
