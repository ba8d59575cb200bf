package com.apisurface.signature.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.CheckCompatibilityOptions;
import com.apisurface.signature.cli.model.ValidatedCheckCompatibilityOptions;
import com.apisurface.signature.cli.output.CheckCompatibilityPrinter;
import com.apisurface.signature.cli.output.SignatureFileWriter;
import com.apisurface.signature.cli.validation.CheckCompatibilityOptionsValidator;
import com.apisurface.signature.compat.Baseline;
import com.apisurface.signature.compat.CompatibilityChecker;
import com.apisurface.signature.compat.CompatibilityConfig;
import com.apisurface.signature.compat.CompatibilityResult;
import com.apisurface.signature.filter.ApiSurfaceFilter;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.parser.exception.ParseException;
import com.apisurface.signature.parser.service.SignatureLoadingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Checks the current API against the previously released one.
 */
@Command(
        name = "check-compatibility",
        mixinStandardHelpOptions = true,
        version = SignatureToolCommand.VERSION,
        description = "Compares the current API signature files with the released ones and reports incompatible changes."
)
public class CheckCompatibilityCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCompatibilityCommand.class);

    @Mixin
    private CheckCompatibilityOptions options = new CheckCompatibilityOptions();

    private final CheckCompatibilityOptionsValidator validator = new CheckCompatibilityOptionsValidator();
    private final CheckCompatibilityPrinter printer = new CheckCompatibilityPrinter();
    private final SignatureLoadingService loadingService = new SignatureLoadingService();

    @Override
    public Integer call() {
        try {
            ValidatedCheckCompatibilityOptions validated = validator.validate(options);
            printer.printBanner(options);

            ApiSurfaceFilter filter = new ApiSurfaceFilter(validated.getFilterConfig());
            Codebase current = filter.filter(loadingService.loadAll(options.getApiFiles()));
            Codebase released = filter.filter(loadingService.loadAll(options.getReleasedFiles()));

            CompatibilityConfig.CompatibilityConfigBuilder config = CompatibilityConfig.builder()
                    .compatibilityAnnotations(options.getCompatibilityAnnotations())
                    .suppressionAnnotation(options.getSuppressionAnnotation())
                    .issueConfiguration(validated.getIssueConfiguration());
            if (options.getRemovedApiFile() != null) {
                config.removedApi(filter.filter(loadingService.load(options.getRemovedApiFile())));
            }
            if (options.getBaselineFile() != null) {
                config.baseline(readBaseline(options.getBaselineFile()));
            }

            CompatibilityResult result = CompatibilityChecker.check(released, current, config.build());
            printer.printIssues(result);

            Path updatedBaseline = options.getUpdateBaselineFile();
            if (updatedBaseline != null) {
                SignatureFileWriter.writeText(updatedBaseline, Baseline.write(result.getUnfilteredIssues()));
            }
            printer.printSummary(result, updatedBaseline);

            return result.hasErrors() && updatedBaseline == null ? 1 : 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (ParseException e) {
            log.error("Failed to parse signature file: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage());
            return 1;
        }
    }

    private static Baseline readBaseline(Path path) throws IOException {
        try {
            return Baseline.read(path);
        } catch (IllegalArgumentException e) {
            throw new OptionsValidationException(List.of("Invalid baseline " + path + ": " + e.getMessage()));
        }
    }
}
