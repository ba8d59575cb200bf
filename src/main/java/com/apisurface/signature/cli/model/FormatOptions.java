package com.apisurface.signature.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "format" command.
 */
@Getter
public class FormatOptions {

    @Option(names = { "--input", "-i" }, required = true, arity = "1..*",
            description = "Signature file(s) to read; several files are merged in order")
    private List<Path> inputFiles = new ArrayList<>();

    @Option(names = { "--output", "-o" }, required = true, description = "Signature file to write")
    private Path outputFile;

    @Option(names = { "--format" },
            description = "Output format: legacy, 2.0, 3.0, 4.0 or 5.0, optionally followed by :name=value,... "
                    + "(default: format of the first input)")
    private String format;

    @Option(names = { "--format-property" }, description = "Output format property as name=value")
    private List<String> formatProperties = new ArrayList<>();

    @Option(names = { "--show-annotation" }, description = "Only keep items carrying this annotation")
    private List<String> showAnnotations = new ArrayList<>();

    @Option(names = { "--hide-annotation" }, description = "Drop items carrying this annotation")
    private List<String> hideAnnotations = new ArrayList<>();

    @Option(names = { "--hide-package" }, description = "Drop this package and its sub-packages")
    private List<String> hidePackages = new ArrayList<>();
}
