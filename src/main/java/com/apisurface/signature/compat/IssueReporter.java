package com.apisurface.signature.compat;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;

/**
 * Collects issues, applying severity overrides and the baseline.
 *
 * Hidden issues are dropped. Baselined issues are counted but not returned as issues.
 */
@Getter
public class IssueReporter {
    private static final Logger log = LoggerFactory.getLogger(IssueReporter.class);

    private final IssueConfiguration configuration;
    private final Baseline baseline;

    /** Issues to report, in detection order. */
    private final List<Issue> issues = new ArrayList<>();

    /** Every non-hidden issue, baselined or not; used to write a new baseline. */
    private final List<Issue> allIssues = new ArrayList<>();

    private int baselinedCount;

    public IssueReporter(IssueConfiguration configuration, Baseline baseline) {
        this.configuration = configuration;
        this.baseline = baseline;
    }

    public void report(IssueType type, String location, String message) {
        Severity severity = configuration.severityOf(type);
        if (severity == Severity.HIDDEN) {
            return;
        }
        Issue issue = Issue.builder()
                .type(type)
                .severity(severity)
                .location(location)
                .message(message)
                .build();
        allIssues.add(issue);
        if (baseline.contains(issue)) {
            baselinedCount++;
            log.debug("Baselined: {}", issue.format());
            return;
        }
        log.debug("Reported: {}", issue.format());
        issues.add(issue);
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(Issue::isError);
    }
}
