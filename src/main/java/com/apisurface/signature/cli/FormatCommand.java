package com.apisurface.signature.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.FormatOptions;
import com.apisurface.signature.cli.model.ValidatedFormatOptions;
import com.apisurface.signature.cli.output.SignatureFilePrinter;
import com.apisurface.signature.cli.output.SignatureFileWriter;
import com.apisurface.signature.cli.validation.FormatOptionsValidator;
import com.apisurface.signature.filter.ApiSurfaceFilter;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.parser.exception.ParseException;
import com.apisurface.signature.parser.service.SignatureLoadingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Reads signature files and writes them back in canonical form, optionally filtered
 * and in another format.
 */
@Command(
        name = "format",
        mixinStandardHelpOptions = true,
        version = SignatureToolCommand.VERSION,
        description = "Merges, filters and rewrites signature files in canonical order, migrating them to another format if requested."
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Mixin
    private FormatOptions options = new FormatOptions();

    private final FormatOptionsValidator validator = new FormatOptionsValidator();
    private final SignatureFilePrinter printer = new SignatureFilePrinter();
    private final SignatureLoadingService loadingService = new SignatureLoadingService();

    @Override
    public Integer call() {
        try {
            ValidatedFormatOptions validated = validator.validate(options);
            printer.printBanner("Format Signature Files", options.getInputFiles(), options.getOutputFile(),
                    validated.getFormat());

            Codebase codebase = loadingService.loadAll(options.getInputFiles());
            codebase = new ApiSurfaceFilter(validated.getFilterConfig()).filter(codebase);
            if (validated.getFormat() != null) {
                codebase = codebase.toBuilder().format(validated.getFormat()).build();
            }

            SignatureFileWriter.write(options.getOutputFile(), codebase);
            printer.printWritten(options.getOutputFile(), codebase);
            return 0;

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
}
