package com.apisurface.signature.model;

import lombok.Getter;

/**
 * Non-visibility modifier keywords. Declaration order is the order in which
 * they are written in a signature file; {@link #DEPRECATED} is a pseudo-modifier
 * and always comes last.
 */
@Getter
public enum Modifier {
    ABSTRACT("abstract"),
    DEFAULT("default"),
    STATIC("static"),
    FINAL("final"),
    SEALED("sealed"),
    SUSPEND("suspend"),
    INLINE("inline"),
    VALUE("value"),
    INFIX("infix"),
    OPERATOR("operator"),
    TRANSIENT("transient"),
    VOLATILE("volatile"),
    SYNCHRONIZED("synchronized"),
    NATIVE("native"),
    STRICTFP("strictfp"),
    FUN("fun"),
    DATA("data"),
    DEPRECATED("deprecated");

    private final String keyword;

    Modifier(String keyword) {
        this.keyword = keyword;
    }

    public static Modifier fromKeyword(String keyword) {
        for (Modifier modifier : values()) {
            if (modifier.keyword.equals(keyword)) {
                return modifier;
            }
        }
        return null;
    }
}
