package com.apisurface.signature.model;

import lombok.Getter;

/**
 * Visibility levels, ordered from most to least restrictive.
 */
@Getter
public enum Visibility {
    PRIVATE("private", 0),
    PACKAGE_PRIVATE("", 1),
    INTERNAL("internal", 2),
    PROTECTED("protected", 3),
    PUBLIC("public", 4);

    private final String keyword;
    private final int level;

    Visibility(String keyword, int level) {
        this.keyword = keyword;
        this.level = level;
    }

    public boolean isNarrowerThan(Visibility other) {
        return level < other.level;
    }

    public static Visibility fromKeyword(String keyword) {
        for (Visibility visibility : values()) {
            if (!visibility.keyword.isEmpty() && visibility.keyword.equals(keyword)) {
                return visibility;
            }
        }
        return null;
    }
}
