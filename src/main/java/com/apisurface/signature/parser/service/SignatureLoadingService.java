package com.apisurface.signature.parser.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.merge.CodebaseMerger;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.parser.SignatureParser;

import lombok.RequiredArgsConstructor;

/**
 * Reads signature files from disk. Several files describing one API are parsed
 * independently and merged in the order given, later files overriding earlier ones.
 */
@RequiredArgsConstructor
public class SignatureLoadingService {
    private static final Logger log = LoggerFactory.getLogger(SignatureLoadingService.class);

    private final CodebaseMerger merger;

    /**
     * Format assumed for files without a header.
     */
    private final FileFormat headerlessFormat;

    public SignatureLoadingService() {
        this(new CodebaseMerger(), FormatVersion.V1.defaults());
    }

    public Codebase load(Path path) throws IOException {
        String fileName = path.toString();
        String content = Files.readString(path, StandardCharsets.UTF_8);
        log.debug("Parsing signature file: {}", fileName);
        return new SignatureParser(content, fileName, headerlessFormat).parse();
    }

    public Codebase loadAll(List<Path> paths) throws IOException {
        List<Codebase> fragments = new ArrayList<>();
        for (Path path : paths) {
            fragments.add(load(path));
        }
        if (fragments.size() > 1) {
            log.debug("Merging {} signature fragments", fragments.size());
        }
        return merger.merge(fragments);
    }

    /**
     * Parses signature text that did not come from a file, e.g. a test fixture.
     */
    public Codebase parse(String fileName, String content) {
        return new SignatureParser(content, fileName, headerlessFormat).parse();
    }
}
