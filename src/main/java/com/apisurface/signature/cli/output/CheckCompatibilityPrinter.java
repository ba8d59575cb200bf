package com.apisurface.signature.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.cli.model.CheckCompatibilityOptions;
import com.apisurface.signature.compat.CompatibilityResult;
import com.apisurface.signature.compat.Issue;
import com.apisurface.signature.compat.Severity;

/**
 * Responsible only for printing CLI output for the "check-compatibility" command.
 */
public class CheckCompatibilityPrinter {

    private static final Logger log = LoggerFactory.getLogger(CheckCompatibilityPrinter.class);

    public void printBanner(CheckCompatibilityOptions o) {
        log.info("=================================================");
        log.info("API Compatibility Check");
        log.info("=================================================");
        log.info("Current API: {}", describe(o.getApiFiles()));
        log.info("Released API: {}", describe(o.getReleasedFiles()));
        log.info("Removed API: {}", o.getRemovedApiFile() != null ? o.getRemovedApiFile() : "None");
        log.info("Baseline: {}", o.getBaselineFile() != null ? o.getBaselineFile() : "None");
        if (!o.getCompatibilityAnnotations().isEmpty()) {
            log.info("Compatibility Annotations: {}", String.join(", ", o.getCompatibilityAnnotations()));
        }
        log.info("=================================================");
    }

    public void printIssues(CompatibilityResult result) {
        for (Issue issue : result.getIssues()) {
            if (issue.getSeverity() == Severity.ERROR) {
                log.error("{}: {}", issue.getLocation(), issue.format());
            } else {
                log.warn("{}: {}", issue.getLocation(), issue.format());
            }
        }
    }

    public void printSummary(CompatibilityResult result, Path updatedBaseline) {
        log.info("");
        log.info("=================================================");
        log.info(result.hasErrors() ? "COMPATIBILITY CHECK FAILED" : "COMPATIBILITY CHECK PASSED");
        log.info("=================================================");
        log.info("Errors: {}", result.errorCount());
        log.info("Warnings: {}", result.warningCount());
        log.info("Baselined: {}", result.getBaselinedCount());
        if (updatedBaseline != null) {
            log.info("Updated Baseline: {}", updatedBaseline.toAbsolutePath());
        }
        log.info("=================================================");
        if (result.hasErrors()) {
            log.error("Aborting: found {} compatibility error(s)", result.errorCount());
        }
    }

    private static String describe(List<Path> paths) {
        return paths.stream().map(Path::toString).collect(Collectors.joining(", "));
    }
}
