package com.apisurface.signature.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "update-header" command.
 */
@Getter
public class UpdateHeaderOptions {

    @Option(names = { "--input", "-i" }, required = true, arity = "1..*",
            description = "Signature files to rewrite in place")
    private List<Path> inputFiles = new ArrayList<>();

    @Option(names = { "--format" }, required = true, description = "Target format: legacy, 2.0, 3.0, 4.0 or 5.0")
    private String format;

    @Option(names = { "--format-property" }, description = "Target format property as name=value")
    private List<String> formatProperties = new ArrayList<>();
}
