package com.apisurface.signature.parser;

import com.apisurface.signature.model.TypeReference;

import lombok.experimental.UtilityClass;

/**
 * Converts constant field literals back into boxed values, guided by the field type.
 */
@UtilityClass
public class ConstantValueParser {

    /**
     * @throws IllegalArgumentException when the literal does not fit the type
     */
    public static Object parse(String literal, TypeReference type) {
        String value = literal.trim();
        String typeName = type.isArray() ? "" : String.valueOf(type.getName());
        try {
            switch (typeName) {
                case "int":
                case "java.lang.Integer":
                    return Integer.valueOf(value);
                case "long":
                case "java.lang.Long":
                    return Long.valueOf(stripSuffix(value, 'L'));
                case "short":
                case "java.lang.Short":
                    return Short.valueOf(value);
                case "byte":
                case "java.lang.Byte":
                    return Byte.valueOf(value);
                case "char":
                case "java.lang.Character":
                    return parseChar(value);
                case "boolean":
                case "java.lang.Boolean":
                    return parseBoolean(value);
                case "float":
                case "java.lang.Float":
                    return parseFloat(value);
                case "double":
                case "java.lang.Double":
                    return parseDouble(value);
                case "java.lang.String":
                    return unquote(value);
                default:
                    return inferFromLiteral(value);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid constant value '" + literal + "' for type " + typeName, e);
        }
    }

    private static Object inferFromLiteral(String value) {
        if (value.startsWith("\"")) {
            return unquote(value);
        }
        if (value.startsWith("'")) {
            return parseChar(value);
        }
        if (value.equals("true") || value.equals("false")) {
            return Boolean.valueOf(value);
        }
        if (value.endsWith("L")) {
            return Long.valueOf(stripSuffix(value, 'L'));
        }
        if (value.endsWith("f") || value.endsWith("F")) {
            return parseFloat(value);
        }
        if (value.contains(".") || value.contains("/")) {
            return parseDouble(value);
        }
        return Integer.valueOf(value);
    }

    private static Character parseChar(String value) {
        if (value.startsWith("'")) {
            String inner = unescape(value.substring(1, value.length() - 1));
            if (inner.length() != 1) {
                throw new IllegalArgumentException("invalid char literal " + value);
            }
            return inner.charAt(0);
        }
        return (char) Integer.parseInt(value);
    }

    private static Boolean parseBoolean(String value) {
        if (!value.equals("true") && !value.equals("false")) {
            throw new IllegalArgumentException("invalid boolean literal " + value);
        }
        return Boolean.valueOf(value);
    }

    private static Float parseFloat(String value) {
        switch (value) {
            case "(0.0f/0.0f)":
            case "(0.0/0.0)":
                return Float.NaN;
            case "(1.0f/0.0f)":
            case "(1.0/0.0)":
                return Float.POSITIVE_INFINITY;
            case "(-1.0f/0.0f)":
            case "(-1.0/0.0)":
                return Float.NEGATIVE_INFINITY;
            default:
                return Float.valueOf(stripSuffix(stripSuffix(value, 'f'), 'F'));
        }
    }

    private static Double parseDouble(String value) {
        switch (value) {
            case "(0.0/0.0)":
                return Double.NaN;
            case "(1.0/0.0)":
                return Double.POSITIVE_INFINITY;
            case "(-1.0/0.0)":
                return Double.NEGATIVE_INFINITY;
            default:
                return Double.valueOf(value);
        }
    }

    private static String stripSuffix(String value, char suffix) {
        return value.endsWith(String.valueOf(suffix)) ? value.substring(0, value.length() - 1) : value;
    }

    static String unquote(String value) {
        if (value.length() < 2 || !value.startsWith("\"") || !value.endsWith("\"")) {
            throw new IllegalArgumentException("invalid string literal " + value);
        }
        return unescape(value.substring(1, value.length() - 1));
    }

    static String unescape(String value) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 >= value.length()) {
                sb.append(c);
                continue;
            }
            char next = value.charAt(++i);
            switch (next) {
                case 'n':
                    sb.append('\n');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 'b':
                    sb.append('\b');
                    break;
                case 'f':
                    sb.append('\f');
                    break;
                case 'u':
                    sb.append((char) Integer.parseInt(value.substring(i + 1, i + 5), 16));
                    i += 4;
                    break;
                default:
                    sb.append(next);
                    break;
            }
        }
        return sb.toString();
    }
}
