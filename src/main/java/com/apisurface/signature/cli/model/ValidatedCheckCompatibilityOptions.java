package com.apisurface.signature.cli.model;

import com.apisurface.signature.compat.IssueConfiguration;
import com.apisurface.signature.filter.FilterConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed to run a compatibility check.
 */
@Data
@AllArgsConstructor
public class ValidatedCheckCompatibilityOptions {
    IssueConfiguration issueConfiguration;
    FilterConfig filterConfig;
}
