package com.apisurface.signature.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "subtract" command.
 */
@Getter
public class SubtractOptions {

    @Option(names = { "--input", "-i" }, required = true, description = "Signature file to subtract from")
    private Path inputFile;

    @Option(names = { "--subtract", "-s" }, required = true, description = "Signature file whose surface is removed")
    private Path subtractFile;

    @Option(names = { "--output", "-o" }, required = true, description = "Signature file to write")
    private Path outputFile;
}
