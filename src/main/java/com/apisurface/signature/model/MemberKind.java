package com.apisurface.signature.model;

import lombok.Getter;

/**
 * Member kinds in the order in which they are grouped inside a class block.
 */
@Getter
public enum MemberKind {
    CONSTRUCTOR("ctor", 0),
    METHOD("method", 1),
    FIELD("field", 2),
    PROPERTY("property", 3),
    ENUM_CONSTANT("enum_constant", 4);

    private final String keyword;
    private final int priority;

    MemberKind(String keyword, int priority) {
        this.keyword = keyword;
        this.priority = priority;
    }

    public boolean isCallable() {
        return this == CONSTRUCTOR || this == METHOD;
    }

    public static MemberKind fromKeyword(String keyword) {
        for (MemberKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }
}
