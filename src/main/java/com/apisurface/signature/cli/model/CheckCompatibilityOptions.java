package com.apisurface.signature.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.apisurface.signature.compat.CompatibilityConfig;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "check-compatibility" command. No validation, no
 * execution logic, no printing.
 */
@Getter
public class CheckCompatibilityOptions {

    @Option(names = { "--api" }, required = true, arity = "1..*",
            description = "Signature file(s) of the current API; several files are merged in order")
    private List<Path> apiFiles = new ArrayList<>();

    @Option(names = { "--released" }, required = true, arity = "1..*",
            description = "Signature file(s) of the previously released API")
    private List<Path> releasedFiles = new ArrayList<>();

    @Option(names = { "--removed-api" }, description = "Released removed-API signature file")
    private Path removedApiFile;

    @Option(names = { "--baseline" }, description = "Baseline of known issues to suppress")
    private Path baselineFile;

    @Option(names = { "--update-baseline" }, description = "Write every detected issue to this baseline file")
    private Path updateBaselineFile;

    @Option(names = { "--error" }, description = "Report the given issue id as an error")
    private List<String> errorIds = new ArrayList<>();

    @Option(names = { "--warning" }, description = "Report the given issue id as a warning")
    private List<String> warningIds = new ArrayList<>();

    @Option(names = { "--hide" }, description = "Do not report the given issue id")
    private List<String> hiddenIds = new ArrayList<>();

    @Option(names = { "--warnings-as-errors" }, description = "Report warnings as errors")
    private boolean warningsAsErrors;

    @Option(names = { "--api-compat-annotation" },
            description = "Annotation whose addition or removal is an incompatible change")
    private List<String> compatibilityAnnotations = new ArrayList<>();

    @Option(names = { "--suppress-compatibility-annotation" },
            defaultValue = CompatibilityConfig.DEFAULT_SUPPRESSION_ANNOTATION,
            description = "Annotation that excludes an item from the check (default: ${DEFAULT-VALUE})")
    private String suppressionAnnotation;

    @Option(names = { "--show-annotation" }, description = "Only check items carrying this annotation")
    private List<String> showAnnotations = new ArrayList<>();

    @Option(names = { "--hide-annotation" }, description = "Ignore items carrying this annotation")
    private List<String> hideAnnotations = new ArrayList<>();

    @Option(names = { "--hide-package" }, description = "Ignore this package and its sub-packages")
    private List<String> hidePackages = new ArrayList<>();
}
