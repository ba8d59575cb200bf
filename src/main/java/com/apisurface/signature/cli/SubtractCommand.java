package com.apisurface.signature.cli;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.SubtractOptions;
import com.apisurface.signature.cli.output.SignatureFilePrinter;
import com.apisurface.signature.cli.output.SignatureFileWriter;
import com.apisurface.signature.cli.validation.SubtractOptionsValidator;
import com.apisurface.signature.merge.CodebaseSubtractor;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.parser.exception.ParseException;
import com.apisurface.signature.parser.service.SignatureLoadingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
        name = "subtract",
        mixinStandardHelpOptions = true,
        version = SignatureToolCommand.VERSION,
        description = "Removes every class and member of one signature file from another."
)
public class SubtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SubtractCommand.class);

    @Mixin
    private SubtractOptions options = new SubtractOptions();

    private final SubtractOptionsValidator validator = new SubtractOptionsValidator();
    private final SignatureFilePrinter printer = new SignatureFilePrinter();
    private final SignatureLoadingService loadingService = new SignatureLoadingService();
    private final CodebaseSubtractor subtractor = new CodebaseSubtractor();

    @Override
    public Integer call() {
        try {
            validator.validate(options);
            printer.printBanner("Subtract Signature Files", List.of(options.getInputFile(), options.getSubtractFile()),
                    options.getOutputFile(), null);

            Codebase minuend = loadingService.load(options.getInputFile());
            Codebase subtrahend = loadingService.load(options.getSubtractFile());
            Codebase remaining = subtractor.subtract(minuend, subtrahend);

            SignatureFileWriter.write(options.getOutputFile(), remaining);
            printer.printWritten(options.getOutputFile(), remaining);
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
