package com.apisurface.signature.cli.validation;

import java.util.ArrayList;
import java.util.List;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.CheckCompatibilityOptions;
import com.apisurface.signature.cli.model.ValidatedCheckCompatibilityOptions;
import com.apisurface.signature.compat.IssueConfiguration;
import com.apisurface.signature.compat.Severity;
import com.apisurface.signature.filter.FilterConfig;

public class CheckCompatibilityOptionsValidator {

    public ValidatedCheckCompatibilityOptions validate(CheckCompatibilityOptions o) {
        List<String> errors = new ArrayList<>();

        OptionChecks.requireFiles("--api", o.getApiFiles(), errors);
        OptionChecks.requireFiles("--released", o.getReleasedFiles(), errors);
        if (o.getRemovedApiFile() != null) {
            OptionChecks.requireFile("--removed-api", o.getRemovedApiFile(), errors);
        }
        if (o.getBaselineFile() != null) {
            OptionChecks.requireFile("--baseline", o.getBaselineFile(), errors);
        }
        if (o.getUpdateBaselineFile() != null) {
            OptionChecks.requireWritable("--update-baseline", o.getUpdateBaselineFile(), errors);
        }
        if (o.getSuppressionAnnotation() == null || o.getSuppressionAnnotation().isBlank()) {
            errors.add("--suppress-compatibility-annotation must not be blank.");
        }

        IssueConfiguration issueConfiguration = new IssueConfiguration();
        issueConfiguration.setWarningsAsErrors(o.isWarningsAsErrors());
        applySeverity(issueConfiguration, "--error", o.getErrorIds(), Severity.ERROR, errors);
        applySeverity(issueConfiguration, "--warning", o.getWarningIds(), Severity.WARNING, errors);
        applySeverity(issueConfiguration, "--hide", o.getHiddenIds(), Severity.HIDDEN, errors);

        FilterConfig filterConfig = OptionChecks.filterConfig(o.getShowAnnotations(), o.getHideAnnotations(),
                o.getHidePackages(), errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedCheckCompatibilityOptions(issueConfiguration, filterConfig);
    }

    private static void applySeverity(IssueConfiguration configuration, String option, List<String> ids,
            Severity severity, List<String> errors) {
        for (String id : ids) {
            try {
                configuration.override(id.trim(), severity);
            } catch (IllegalArgumentException e) {
                errors.add("Invalid " + option + " value: " + e.getMessage());
            }
        }
    }
}
