package com.apisurface.signature.format;

import java.util.LinkedHashMap;
import java.util.Map;

import com.apisurface.signature.model.Nullability;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Version plus feature flags that govern how a signature file is read and written.
 *
 * Every parse and every render takes exactly one FileFormat; converting between
 * formats means parsing with one and writing with another.
 */
@Value
@Builder(toBuilder = true)
public class FileFormat {

    public static final String SIGNATURE_FORMAT_PREFIX = "// Signature format: ";
    public static final String PROPERTY_LINE_PREFIX = "// - ";

    private static final String VERSION_PROPERTIES_SEPARATOR = ":";

    @NonNull
    FormatVersion version;

    /**
     * Nullability written as {@code ?} and {@code !} suffixes instead of annotations.
     */
    boolean kotlinStyleNulls;

    /**
     * Parameters with defaults are marked {@code optional}.
     */
    boolean includeDefaultParameterValues;

    /**
     * Only the {@code optional} marker is written, never the default value itself.
     */
    boolean conciseDefaultValues;

    /**
     * Names precede types: {@code name: Type}.
     */
    boolean kotlinNameTypeOrder;

    boolean includeTypeUseAnnotations;

    /**
     * Sort the whole interface list lexicographically instead of keeping the first
     * declared interface of an interface in front.
     */
    boolean sortWholeExtendsList;

    @NonNull
    @Builder.Default
    OverloadedMethodOrder overloadedMethodOrder = OverloadedMethodOrder.SIGNATURE;

    /**
     * Reason for customizing a version that only supports properties while migrating.
     */
    String migrating;

    public static FileFormat defaultFormat() {
        return FormatVersion.V2.defaults();
    }

    public static FileFormat forVersion(FormatVersion version) {
        return version.defaults();
    }

    /**
     * Nullability of a type that carries no nullability information in this format.
     */
    public Nullability unannotatedNullability() {
        return version == FormatVersion.V1 ? Nullability.UNDEFINED : Nullability.PLATFORM;
    }

    /**
     * Returns a copy with one property changed.
     *
     * @throws IllegalArgumentException on an unknown property or value
     */
    public FileFormat withProperty(String name, String value) {
        FileFormatBuilder builder = toBuilder();
        FormatProperty.byName(name).apply(builder, value);
        return builder.build();
    }

    /**
     * Properties whose value differs from this version's defaults, in writing order.
     */
    public Map<String, String> overridingProperties() {
        FileFormat defaults = version.defaults();
        Map<String, String> overriding = new LinkedHashMap<>();
        for (FormatProperty property : FormatProperty.values()) {
            String value = property.valueOf(this);
            if (!value.equals(property.valueOf(defaults))) {
                overriding.put(property.propertyName(), value);
            }
        }
        return overriding;
    }

    /**
     * Version number followed by {@code :name=value,...} for every overriding property.
     */
    public String specifier() {
        StringBuilder sb = new StringBuilder(version.getVersionNumber());
        String separator = VERSION_PROPERTIES_SEPARATOR;
        for (Map.Entry<String, String> entry : overridingProperties().entrySet()) {
            sb.append(separator).append(entry.getKey()).append('=').append(entry.getValue());
            separator = ",";
        }
        return sb.toString();
    }

    /**
     * Header lines, each terminated by a newline. Empty for the legacy format.
     *
     * @throws IllegalStateException when the format cannot record its own customizations
     */
    public String header() {
        Map<String, String> overriding = overridingProperties();
        if (!version.isHeaderRequired()) {
            if (!overriding.isEmpty()) {
                throw new IllegalStateException("legacy format " + version.getVersionNumber()
                        + " cannot record properties " + overriding.keySet());
            }
            return "";
        }
        if (version.isFullPropertySupport()) {
            StringBuilder sb = new StringBuilder(SIGNATURE_FORMAT_PREFIX)
                    .append(version.getVersionNumber())
                    .append('\n');
            overriding.forEach((name, value) ->
                    sb.append(PROPERTY_LINE_PREFIX).append(name).append('=').append(value).append('\n'));
            return sb.toString();
        }
        if (!overriding.isEmpty() && migrating == null) {
            throw new IllegalStateException("must provide a 'migrating' property when customizing version "
                    + version.getVersionNumber());
        }
        String specifier = migrating != null ? specifier() : version.getVersionNumber();
        return SIGNATURE_FORMAT_PREFIX + specifier + "\n";
    }
}
