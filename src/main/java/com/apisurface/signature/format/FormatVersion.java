package com.apisurface.signature.format;

import java.util.Arrays;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Signature file format versions.
 */
@Getter
public enum FormatVersion {
    /**
     * Legacy dialect used when a file has no header.
     */
    V1("1.0", false, false),
    V2("2.0", true, false),
    V3("3.0", true, false),
    V4("4.0", true, false),
    V5("5.0", true, true);

    private final String versionNumber;
    private final boolean headerRequired;

    /**
     * True when properties are written one per line after the version line; older
     * versions only carry properties inline while migrating.
     */
    private final boolean fullPropertySupport;

    FormatVersion(String versionNumber, boolean headerRequired, boolean fullPropertySupport) {
        this.versionNumber = versionNumber;
        this.headerRequired = headerRequired;
        this.fullPropertySupport = fullPropertySupport;
    }

    public FileFormat defaults() {
        FileFormat.FileFormatBuilder builder = FileFormat.builder().version(this);
        switch (this) {
            case V1:
            case V2:
                break;
            case V3:
                builder.kotlinStyleNulls(true).includeDefaultParameterValues(true);
                break;
            case V4:
            case V5:
            default:
                builder.kotlinStyleNulls(true).includeDefaultParameterValues(true).conciseDefaultValues(true);
                break;
        }
        return builder.build();
    }

    /**
     * Versions that may appear in a header.
     */
    public static String headerVersionList() {
        return Arrays.stream(values())
                .filter(FormatVersion::isHeaderRequired)
                .map(v -> "'" + v.versionNumber + "'")
                .collect(Collectors.joining(", "));
    }

    public static FormatVersion fromHeaderNumber(String versionNumber) {
        for (FormatVersion version : values()) {
            if (version.headerRequired && version.versionNumber.equals(versionNumber)) {
                return version;
            }
        }
        return null;
    }
}
