package com.apisurface.signature.format;

import lombok.experimental.UtilityClass;

/**
 * Renders compile-time constant values as source literals, with the hexadecimal
 * comment written after integral constants.
 */
@UtilityClass
public class ConstantValueRenderer {

    /**
     * Source literal for the value, e.g. {@code 42L}, {@code 98.5f} or {@code "a\"b"}.
     */
    public static String literal(Object value) {
        if (value instanceof String) {
            return quote((String) value);
        }
        if (value instanceof Character) {
            return Integer.toString((Character) value);
        }
        if (value instanceof Long) {
            return value + "L";
        }
        if (value instanceof Float) {
            float f = (Float) value;
            if (Float.isNaN(f)) {
                return "(0.0f/0.0f)";
            }
            if (Float.isInfinite(f)) {
                return f > 0 ? "(1.0f/0.0f)" : "(-1.0f/0.0f)";
            }
            return Float.toString(f) + "f";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d)) {
                return "(0.0/0.0)";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "(1.0/0.0)" : "(-1.0/0.0)";
            }
            return Double.toString(d);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte || value instanceof Boolean) {
            return value.toString();
        }
        throw new IllegalArgumentException("Not a constant value: " + value.getClass().getName());
    }

    /**
     * Trailing comment text without the {@code //}, or null for non-integral values.
     */
    public static String comment(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return "0x" + Integer.toHexString(((Number) value).intValue());
        }
        if (value instanceof Long) {
            return "0x" + Long.toHexString((Long) value) + "L";
        }
        if (value instanceof Character) {
            char c = (Character) value;
            return String.format("0x%04x '%s'", (int) c, escape(c, '\''));
        }
        return null;
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            sb.append(escape(value.charAt(i), '"'));
        }
        return sb.append('"').toString();
    }

    private static String escape(char c, char quote) {
        switch (c) {
            case '\\':
                return "\\\\";
            case '\n':
                return "\\n";
            case '\t':
                return "\\t";
            case '\r':
                return "\\r";
            case '\b':
                return "\\b";
            case '\f':
                return "\\f";
            default:
                if (c == quote) {
                    return "\\" + c;
                }
                if (c < 0x20 || c > 0x7e) {
                    return String.format("\\u%04x", (int) c);
                }
                return String.valueOf(c);
        }
    }
}
