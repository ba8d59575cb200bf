package com.apisurface.signature.compat;

import java.util.EnumMap;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

/**
 * Severity overrides for compatibility rules.
 */
@Getter
public class IssueConfiguration {

    private final Map<IssueType, Severity> overrides = new EnumMap<>(IssueType.class);

    /**
     * Reports every warning as an error.
     */
    @Setter
    private boolean warningsAsErrors;

    /**
     * @throws IllegalArgumentException on an unknown rule id
     */
    public IssueConfiguration override(String ruleId, Severity severity) {
        overrides.put(IssueType.fromRuleId(ruleId), severity);
        return this;
    }

    public Severity severityOf(IssueType type) {
        Severity severity = overrides.getOrDefault(type, type.getDefaultSeverity());
        if (warningsAsErrors && severity == Severity.WARNING) {
            return Severity.ERROR;
        }
        return severity;
    }
}
