package com.apisurface.signature.cli.validation;

import java.util.List;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.parser.FileFormatHeaderParser;
import com.apisurface.signature.parser.exception.ParseException;

import lombok.experimental.UtilityClass;

/**
 * Turns {@code --format} and {@code --format-property} values into a {@link FileFormat}.
 */
@UtilityClass
public class FormatSpecifiers {

    public static final String LEGACY = "legacy";

    /**
     * Returns the requested format, or null when none was requested. Problems are added
     * to {@code errors}.
     */
    public static FileFormat parse(String specifier, List<String> properties, List<String> errors) {
        if (specifier == null || specifier.isBlank()) {
            if (!properties.isEmpty()) {
                errors.add("--format-property requires --format.");
            }
            return null;
        }

        FileFormat format;
        String trimmed = specifier.trim();
        if (LEGACY.equalsIgnoreCase(trimmed) || FormatVersion.V1.getVersionNumber().equals(trimmed)) {
            format = FormatVersion.V1.defaults();
        } else {
            try {
                format = FileFormatHeaderParser.parseSpecifier(trimmed, "--format", 1);
            } catch (ParseException e) {
                errors.add("Invalid --format '" + specifier + "': " + e.getReason());
                return null;
            }
        }

        for (String property : properties) {
            int equals = property.indexOf('=');
            if (equals < 0) {
                errors.add("Invalid --format-property '" + property + "': expected <property>=<value>.");
                continue;
            }
            try {
                format = format.withProperty(property.substring(0, equals).trim(), property.substring(equals + 1).trim());
            } catch (IllegalArgumentException e) {
                errors.add("Invalid --format-property '" + property + "': " + e.getMessage());
            }
        }

        try {
            format.header();
        } catch (IllegalStateException e) {
            errors.add("Format " + format.specifier() + " cannot be written: " + e.getMessage());
        }
        return format;
    }
}
