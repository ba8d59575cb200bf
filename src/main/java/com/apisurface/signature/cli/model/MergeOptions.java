package com.apisurface.signature.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "merge" command.
 */
@Getter
public class MergeOptions {

    @Option(names = { "--input", "-i" }, required = true, arity = "1..*",
            description = "Signature fragments, later fragments override earlier ones")
    private List<Path> inputFiles = new ArrayList<>();

    @Option(names = { "--output", "-o" }, required = true, description = "Merged signature file to write")
    private Path outputFile;

    @Option(names = { "--format" }, description = "Output format (default: format of the first input)")
    private String format;
}
