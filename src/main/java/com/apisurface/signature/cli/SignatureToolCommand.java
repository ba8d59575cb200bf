package com.apisurface.signature.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; all work is done by its subcommands.
 */
@Command(
        name = "api-signature-tool",
        mixinStandardHelpOptions = true,
        version = SignatureToolCommand.VERSION,
        description = "Reads, writes, merges and compares API signature files.",
        subcommands = {
                CheckCompatibilityCommand.class,
                FormatCommand.class,
                MergeCommand.class,
                SubtractCommand.class,
                UpdateHeaderCommand.class
        }
)
public class SignatureToolCommand implements Callable<Integer> {

    public static final String VERSION = "api-signature-tool 1.0.0";

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
