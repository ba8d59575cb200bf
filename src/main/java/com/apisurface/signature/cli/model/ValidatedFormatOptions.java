package com.apisurface.signature.cli.model;

import com.apisurface.signature.filter.FilterConfig;
import com.apisurface.signature.format.FileFormat;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values for the commands that write signature files.
 */
@Data
@AllArgsConstructor
public class ValidatedFormatOptions {
    /**
     * Null to keep the format of the first input.
     */
    FileFormat format;
    FilterConfig filterConfig;
}
