package com.apisurface.signature.cli.validation;

import java.util.ArrayList;
import java.util.List;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.SubtractOptions;

public class SubtractOptionsValidator {

    public void validate(SubtractOptions o) {
        List<String> errors = new ArrayList<>();

        OptionChecks.requireFile("--input", o.getInputFile(), errors);
        OptionChecks.requireFile("--subtract", o.getSubtractFile(), errors);
        OptionChecks.requireWritable("--output", o.getOutputFile(), errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
    }
}
