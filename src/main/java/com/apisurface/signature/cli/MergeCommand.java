package com.apisurface.signature.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.MergeOptions;
import com.apisurface.signature.cli.model.ValidatedFormatOptions;
import com.apisurface.signature.cli.output.SignatureFilePrinter;
import com.apisurface.signature.cli.output.SignatureFileWriter;
import com.apisurface.signature.cli.validation.MergeOptionsValidator;
import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.merge.CodebaseMerger;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.parser.exception.ParseException;
import com.apisurface.signature.parser.service.SignatureLoadingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
        name = "merge",
        mixinStandardHelpOptions = true,
        version = SignatureToolCommand.VERSION,
        description = "Merges signature fragments into one file; later fragments override earlier ones."
)
public class MergeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    @Mixin
    private MergeOptions options = new MergeOptions();

    private final MergeOptionsValidator validator = new MergeOptionsValidator();
    private final SignatureFilePrinter printer = new SignatureFilePrinter();

    @Override
    public Integer call() {
        try {
            ValidatedFormatOptions validated = validator.validate(options);
            printer.printBanner("Merge Signature Files", options.getInputFiles(), options.getOutputFile(),
                    validated.getFormat());

            SignatureLoadingService loadingService = new SignatureLoadingService(
                    new CodebaseMerger(validated.getFormat()), FormatVersion.V1.defaults());
            Codebase merged = loadingService.loadAll(options.getInputFiles());

            SignatureFileWriter.write(options.getOutputFile(), merged);
            printer.printWritten(options.getOutputFile(), merged);
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
