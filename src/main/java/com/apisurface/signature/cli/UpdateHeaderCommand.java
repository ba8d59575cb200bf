package com.apisurface.signature.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.UpdateHeaderOptions;
import com.apisurface.signature.cli.model.ValidatedFormatOptions;
import com.apisurface.signature.cli.output.SignatureFilePrinter;
import com.apisurface.signature.cli.output.SignatureFileWriter;
import com.apisurface.signature.cli.validation.UpdateHeaderOptionsValidator;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.parser.exception.ParseException;
import com.apisurface.signature.parser.service.SignatureLoadingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
        name = "update-header",
        mixinStandardHelpOptions = true,
        version = SignatureToolCommand.VERSION,
        description = "Rewrites signature files in place in another format."
)
public class UpdateHeaderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(UpdateHeaderCommand.class);

    @Mixin
    private UpdateHeaderOptions options = new UpdateHeaderOptions();

    private final UpdateHeaderOptionsValidator validator = new UpdateHeaderOptionsValidator();
    private final SignatureFilePrinter printer = new SignatureFilePrinter();
    private final SignatureLoadingService loadingService = new SignatureLoadingService();

    @Override
    public Integer call() {
        try {
            ValidatedFormatOptions validated = validator.validate(options);
            printer.printBanner("Update Signature Headers", options.getInputFiles(), null, validated.getFormat());

            // Parse everything first so a bad file leaves every file untouched.
            Map<Path, Codebase> parsed = new LinkedHashMap<>();
            for (Path input : options.getInputFiles()) {
                parsed.put(input, loadingService.load(input).toBuilder().format(validated.getFormat()).build());
            }
            for (Map.Entry<Path, Codebase> entry : parsed.entrySet()) {
                SignatureFileWriter.write(entry.getKey(), entry.getValue());
                printer.printWritten(entry.getKey(), entry.getValue());
            }
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
