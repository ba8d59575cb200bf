package com.apisurface.signature.cli.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.apisurface.signature.format.SignatureWriter;
import com.apisurface.signature.model.Codebase;

import lombok.experimental.UtilityClass;

/**
 * Writes codebases to signature files, creating parent directories if needed.
 */
@UtilityClass
public class SignatureFileWriter {

    /**
     * Renders the codebase in its own format and writes it as UTF-8.
     *
     * @return the text written
     */
    public static String write(Path file, Codebase codebase) throws IOException {
        String text = SignatureWriter.write(codebase);
        writeText(file, text);
        return text;
    }

    public static void writeText(Path file, String text) throws IOException {
        Path parentDir = file.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(file, text, StandardCharsets.UTF_8);
    }
}
