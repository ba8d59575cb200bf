package com.apisurface.signature.compat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Known issues that should not be reported again.
 *
 * File layout:
 * <pre>
 * // Baseline format: 1.0
 * ChangedThrows: test.pkg.Foo#m():
 *     Method test.pkg.Foo.m no longer throws exception java.io.IOException
 * </pre>
 * An issue is baselined when its rule id and location match an entry.
 */
public class Baseline {
    private static final Logger log = LoggerFactory.getLogger(Baseline.class);

    public static final String HEADER = "// Baseline format: 1.0";

    private static final String INDENT = "    ";

    /** "RuleId: location" to recorded message. */
    private final Map<String, String> entries;

    private Baseline(Map<String, String> entries) {
        this.entries = entries;
    }

    public static Baseline empty() {
        return new Baseline(new LinkedHashMap<>());
    }

    public static Baseline read(Path path) throws IOException {
        Baseline baseline = parse(Files.readString(path, StandardCharsets.UTF_8));
        log.debug("Loaded {} baseline entries from {}", baseline.size(), path);
        return baseline;
    }

    /**
     * @throws IllegalArgumentException when the text is not a baseline
     */
    public static Baseline parse(String text) {
        Map<String, String> entries = new LinkedHashMap<>();
        String[] lines = text.split("\r?\n", -1);
        String key = null;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith("//")) {
                if (i == 0 && !line.trim().equals(HEADER)) {
                    throw new IllegalArgumentException("unsupported baseline header '" + line.trim() + "'");
                }
                continue;
            }
            if (Character.isWhitespace(line.charAt(0))) {
                if (key == null) {
                    throw new IllegalArgumentException("line " + (i + 1) + ": message without an issue line");
                }
                entries.put(key, line.trim());
                continue;
            }
            if (!line.endsWith(":") || line.indexOf(": ") < 0) {
                throw new IllegalArgumentException("line " + (i + 1) + ": expected '<RuleId>: <location>:', found '"
                        + line + "'");
            }
            key = line.substring(0, line.length() - 1);
            entries.putIfAbsent(key, "");
        }
        return new Baseline(entries);
    }

    public boolean contains(Issue issue) {
        return entries.containsKey(key(issue));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Renders issues as baseline text, sorted by rule id and location.
     */
    public static String write(List<Issue> issues) {
        List<Issue> sorted = new ArrayList<>(issues);
        sorted.sort(Comparator.comparing(Issue::getRuleId).thenComparing(Issue::getLocation));
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        String previous = null;
        for (Issue issue : sorted) {
            String key = key(issue);
            if (key.equals(previous)) {
                continue;
            }
            sb.append(key).append(":\n")
                    .append(INDENT).append(issue.getMessage()).append("\n\n");
            previous = key;
        }
        return sb.toString();
    }

    private static String key(Issue issue) {
        return issue.getRuleId() + ": " + issue.getLocation();
    }
}
