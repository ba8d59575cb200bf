package com.apisurface.signature.compat;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One detected compatibility problem.
 */
@Value
@Builder
public class Issue {

    @NonNull
    IssueType type;

    @NonNull
    Severity severity;

    /**
     * Stable location of the affected item, e.g. {@code test.pkg.Foo#m(int)}.
     */
    @NonNull
    String location;

    @NonNull
    String message;

    public String getRuleId() {
        return type.getRuleId();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Diagnostic line, e.g. {@code error: Removed class test.pkg.Foo [RemovedClass]}.
     */
    public String format() {
        return severity.getLabel() + ": " + message + " [" + getRuleId() + "]";
    }
}
