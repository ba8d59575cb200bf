package com.apisurface.signature.cli.validation;

import java.util.ArrayList;
import java.util.List;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.UpdateHeaderOptions;
import com.apisurface.signature.cli.model.ValidatedFormatOptions;
import com.apisurface.signature.filter.FilterConfig;
import com.apisurface.signature.format.FileFormat;

public class UpdateHeaderOptionsValidator {

    public ValidatedFormatOptions validate(UpdateHeaderOptions o) {
        List<String> errors = new ArrayList<>();

        OptionChecks.requireFiles("--input", o.getInputFiles(), errors);
        FileFormat format = FormatSpecifiers.parse(o.getFormat(), o.getFormatProperties(), errors);
        if (format == null && errors.isEmpty()) {
            errors.add("--format is required.");
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return new ValidatedFormatOptions(format, FilterConfig.none());
    }
}
