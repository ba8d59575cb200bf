package com.apisurface.signature;

import com.apisurface.signature.cli.SignatureToolCommand;

import picocli.CommandLine;

/**
 * Main entry point of the API signature tool.
 * Formats and migrates signature files, merges and subtracts API fragments, and checks
 * a current API against a released one for incompatible changes.
 */
public class SignatureToolApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SignatureToolCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
