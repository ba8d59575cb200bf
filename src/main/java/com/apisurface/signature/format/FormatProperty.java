package com.apisurface.signature.format;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Format properties that may override a version's defaults, in the order they
 * are written.
 */
public enum FormatProperty {
    CONCISE_DEFAULT_VALUES {
        @Override
        String valueOf(FileFormat format) {
            return yesNo(format.isConciseDefaultValues());
        }

        @Override
        void apply(FileFormat.FileFormatBuilder builder, String value) {
            builder.conciseDefaultValues(parseYesNo(value));
        }
    },
    INCLUDE_DEFAULT_PARAMETER_VALUES {
        @Override
        String valueOf(FileFormat format) {
            return yesNo(format.isIncludeDefaultParameterValues());
        }

        @Override
        void apply(FileFormat.FileFormatBuilder builder, String value) {
            builder.includeDefaultParameterValues(parseYesNo(value));
        }
    },
    INCLUDE_TYPE_USE_ANNOTATIONS {
        @Override
        String valueOf(FileFormat format) {
            return yesNo(format.isIncludeTypeUseAnnotations());
        }

        @Override
        void apply(FileFormat.FileFormatBuilder builder, String value) {
            builder.includeTypeUseAnnotations(parseYesNo(value));
        }
    },
    KOTLIN_NAME_TYPE_ORDER {
        @Override
        String valueOf(FileFormat format) {
            return yesNo(format.isKotlinNameTypeOrder());
        }

        @Override
        void apply(FileFormat.FileFormatBuilder builder, String value) {
            builder.kotlinNameTypeOrder(parseYesNo(value));
        }
    },
    KOTLIN_STYLE_NULLS {
        @Override
        String valueOf(FileFormat format) {
            return yesNo(format.isKotlinStyleNulls());
        }

        @Override
        void apply(FileFormat.FileFormatBuilder builder, String value) {
            builder.kotlinStyleNulls(parseYesNo(value));
        }
    },
    MIGRATING {
        @Override
        String valueOf(FileFormat format) {
            return format.getMigrating() == null ? "" : format.getMigrating();
        }

        @Override
        void apply(FileFormat.FileFormatBuilder builder, String value) {
            if (value.contains(",") || value.contains("\n")) {
                throw new IllegalArgumentException("invalid value for property 'migrating': '" + value
                        + "' contains at least one invalid character from the set {',', '\\n'}");
            }
            builder.migrating(value.isEmpty() ? null : value);
        }
    },
    OVERLOADED_METHOD_ORDER {
        @Override
        String valueOf(FileFormat format) {
            return format.getOverloadedMethodOrder().propertyValue();
        }

        @Override
        void apply(FileFormat.FileFormatBuilder builder, String value) {
            for (OverloadedMethodOrder order : OverloadedMethodOrder.values()) {
                if (order.propertyValue().equals(value)) {
                    builder.overloadedMethodOrder(order);
                    return;
                }
            }
            throw new IllegalArgumentException("unexpected value for " + propertyName() + ", found '" + value
                    + "', expected one of 'signature' or 'source'");
        }
    },
    SORT_WHOLE_EXTENDS_LIST {
        @Override
        String valueOf(FileFormat format) {
            return yesNo(format.isSortWholeExtendsList());
        }

        @Override
        void apply(FileFormat.FileFormatBuilder builder, String value) {
            builder.sortWholeExtendsList(parseYesNo(value));
        }
    };

    abstract String valueOf(FileFormat format);

    abstract void apply(FileFormat.FileFormatBuilder builder, String value);

    public String propertyName() {
        return name().toLowerCase(Locale.US).replace('_', '-');
    }

    /**
     * Looks up a property by its external name.
     *
     * @throws IllegalArgumentException when the name is unknown
     */
    public static FormatProperty byName(String name) {
        for (FormatProperty property : values()) {
            if (property.propertyName().equals(name)) {
                return property;
            }
        }
        throw new IllegalArgumentException("unknown format property name `" + name + "`, expected one of '"
                + Arrays.stream(values()).map(FormatProperty::propertyName).collect(Collectors.joining("', '"))
                + "'");
    }

    String yesNo(boolean value) {
        return value ? "yes" : "no";
    }

    boolean parseYesNo(String value) {
        switch (value) {
            case "yes":
                return true;
            case "no":
                return false;
            default:
                throw new IllegalArgumentException("unexpected value for " + propertyName() + ", found '" + value
                        + "', expected one of 'yes' or 'no'");
        }
    }
}
