package com.apisurface.signature.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.apisurface.signature.filter.FilterConfig;

import lombok.experimental.UtilityClass;

@UtilityClass
class OptionChecks {

    static void requireFiles(String option, List<Path> paths, List<String> errors) {
        if (paths == null || paths.isEmpty()) {
            errors.add(option + " requires at least one file.");
            return;
        }
        for (Path path : paths) {
            requireFile(option, path, errors);
        }
    }

    static void requireFile(String option, Path path, List<String> errors) {
        if (path == null) {
            errors.add(option + " is required.");
        } else if (!Files.isRegularFile(path)) {
            errors.add("File given to " + option + " does not exist or is not a file: " + path);
        }
    }

    static void requireWritable(String option, Path path, List<String> errors) {
        if (path == null) {
            errors.add(option + " is required.");
            return;
        }
        if (Files.isDirectory(path)) {
            errors.add("File given to " + option + " is a directory: " + path);
        }
    }

    static FilterConfig filterConfig(List<String> show, List<String> hide, List<String> hidePackages,
            List<String> errors) {
        for (String annotation : show) {
            if (hide.contains(annotation)) {
                errors.add("Annotation " + annotation + " is both shown and hidden.");
            }
        }
        return FilterConfig.builder()
                .showAnnotations(show)
                .hideAnnotations(hide)
                .hidePackages(hidePackages)
                .build();
    }
}
