package com.apisurface.signature.parser;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.parser.exception.ParseException;

import lombok.experimental.UtilityClass;

/**
 * Reads the {@code // Signature format: N.N} header and any property lines that follow it.
 */
@UtilityClass
public class FileFormatHeaderParser {

    private static final String VERSION_PROPERTIES_SEPARATOR = ":";

    /**
     * Returns the format declared by the header, or null when the first non-blank line
     * is not a format header.
     *
     * @throws ParseException when the header is present but invalid
     */
    public static FileFormat parseHeader(String source, String fileName) {
        String[] lines = source.split("\n", -1);
        int index = 0;
        while (index < lines.length && lines[index].isBlank()) {
            index++;
        }
        if (index >= lines.length || !lines[index].startsWith(FileFormat.SIGNATURE_FORMAT_PREFIX)) {
            return null;
        }
        int lineNumber = index + 1;
        String specifier = lines[index].substring(FileFormat.SIGNATURE_FORMAT_PREFIX.length()).trim();
        FileFormat format = parseSpecifier(specifier, fileName, lineNumber);
        if (!format.getVersion().isFullPropertySupport()) {
            return format;
        }

        for (index++; index < lines.length; index++) {
            String line = lines[index];
            if (!line.startsWith(FileFormat.PROPERTY_LINE_PREFIX)) {
                break;
            }
            format = applyAssignment(format, line.substring(FileFormat.PROPERTY_LINE_PREFIX.length()).trim(),
                    fileName, index + 1);
        }
        return format;
    }

    /**
     * Parses {@code version[:name=value,...]}. Customizing a version that only supports
     * properties while migrating requires a {@code migrating} property.
     *
     * @throws ParseException when the version or any property is invalid
     */
    public static FileFormat parseSpecifier(String specifier, String fileName, int lineNumber) {
        int separator = specifier.indexOf(VERSION_PROPERTIES_SEPARATOR);
        String versionNumber = separator < 0 ? specifier : specifier.substring(0, separator);
        FormatVersion version = FormatVersion.fromHeaderNumber(versionNumber);
        if (version == null) {
            throw new ParseException("invalid version, found '" + versionNumber + "', expected one of "
                    + FormatVersion.headerVersionList(), fileName, lineNumber);
        }
        FileFormat defaults = version.defaults();
        if (separator < 0) {
            return defaults;
        }
        if (version.isFullPropertySupport()) {
            throw new ParseException("invalid specifier, '" + specifier + "' version " + versionNumber
                    + " does not support properties on the version line", fileName, lineNumber);
        }

        FileFormat format = defaults;
        for (String assignment : specifier.substring(separator + 1).split(",")) {
            format = applyAssignment(format, assignment.trim(), fileName, lineNumber);
        }
        if (!format.equals(defaults) && format.getMigrating() == null) {
            throw new ParseException("invalid format specifier: '" + specifier
                    + "' - must provide a 'migrating' property when customizing version " + versionNumber,
                    fileName, lineNumber);
        }
        return format;
    }

    private static FileFormat applyAssignment(FileFormat format, String assignment, String fileName, int lineNumber) {
        int equals = assignment.indexOf('=');
        if (equals < 0) {
            throw new ParseException("expected <property>=<value> but found '" + assignment + "'", fileName,
                    lineNumber);
        }
        try {
            return format.withProperty(assignment.substring(0, equals).trim(), assignment.substring(equals + 1).trim());
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), fileName, lineNumber, e);
        }
    }
}
