package com.apisurface.signature.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.model.Codebase;

/**
 * Prints CLI output for the commands that write signature files.
 */
public class SignatureFilePrinter {

    private static final Logger log = LoggerFactory.getLogger(SignatureFilePrinter.class);

    public void printBanner(String title, List<Path> inputs, Path output, FileFormat format) {
        log.info("=================================================");
        log.info(title);
        log.info("=================================================");
        log.info("Input: {}", inputs.stream().map(Path::toString).collect(Collectors.joining(", ")));
        log.info("Output: {}", output != null ? output : "in place");
        log.info("Format: {}", format != null ? format.specifier() : "unchanged");
        log.info("=================================================");
    }

    public void printWritten(Path output, Codebase codebase) {
        long classes = codebase.allClasses().count();
        long members = codebase.allClasses().mapToLong(c -> c.getMembers().size()).sum();
        log.info("Wrote {} ({} packages, {} classes, {} members, format {})", output.toAbsolutePath(),
                codebase.getPackages().size(), classes, members, codebase.getFormat().specifier());
    }
}
