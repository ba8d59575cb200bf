package com.apisurface.signature.compat;

import lombok.Getter;

@Getter
public enum Severity {
    /** Never reported. */
    HIDDEN("hidden"),
    WARNING("warning"),
    ERROR("error");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public static Severity fromLabel(String label) {
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(label)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("unknown severity '" + label + "', expected one of hidden, warning, error");
    }
}
