package com.apisurface.signature.cli.validation;

import java.util.ArrayList;
import java.util.List;

import com.apisurface.signature.cli.exception.OptionsValidationException;
import com.apisurface.signature.cli.model.MergeOptions;
import com.apisurface.signature.cli.model.ValidatedFormatOptions;
import com.apisurface.signature.filter.FilterConfig;
import com.apisurface.signature.format.FileFormat;

public class MergeOptionsValidator {

    public ValidatedFormatOptions validate(MergeOptions o) {
        List<String> errors = new ArrayList<>();

        OptionChecks.requireFiles("--input", o.getInputFiles(), errors);
        OptionChecks.requireWritable("--output", o.getOutputFile(), errors);
        FileFormat format = FormatSpecifiers.parse(o.getFormat(), List.of(), errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return new ValidatedFormatOptions(format, FilterConfig.none());
    }
}
