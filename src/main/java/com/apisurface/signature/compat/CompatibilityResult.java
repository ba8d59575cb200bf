package com.apisurface.signature.compat;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class CompatibilityResult {

    /**
     * Issues in traversal order, baselined ones excluded.
     */
    @Singular
    List<Issue> issues;

    /**
     * Every non-hidden issue including baselined ones.
     */
    @Singular("unfilteredIssue")
    List<Issue> unfilteredIssues;

    int baselinedCount;

    public long errorCount() {
        return issues.stream().filter(Issue::isError).count();
    }

    public long warningCount() {
        return issues.stream().filter(i -> i.getSeverity() == Severity.WARNING).count();
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }
}
