package com.apisurface.signature.model;

import lombok.Getter;

@Getter
public enum ClassKind {
    CLASS("class"),
    INTERFACE("interface"),
    ENUM("enum"),
    ANNOTATION("@interface"),
    RECORD("record");

    private final String keyword;

    ClassKind(String keyword) {
        this.keyword = keyword;
    }

    public boolean isInterfaceLike() {
        return this == INTERFACE || this == ANNOTATION;
    }

    public static ClassKind fromKeyword(String keyword) {
        for (ClassKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }
}
