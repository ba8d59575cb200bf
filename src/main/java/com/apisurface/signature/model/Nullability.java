package com.apisurface.signature.model;

/**
 * Nullability of a type occurrence.
 *
 * PLATFORM and UNDEFINED both mean "not specified", but they come from different
 * dialects and must survive a round trip separately: PLATFORM is written by formats
 * that know about nullability, UNDEFINED by the legacy format that predates it.
 */
public enum Nullability {
    NONNULL,
    NULLABLE,
    PLATFORM,
    UNDEFINED;

    public boolean isSpecified() {
        return this == NONNULL || this == NULLABLE;
    }

    /**
     * Maps a nullability annotation name (simple or qualified) to its nullability,
     * or returns null when the annotation is not a nullability annotation.
     */
    public static Nullability fromAnnotation(String annotationName) {
        String simple = annotationName.substring(annotationName.lastIndexOf('.') + 1);
        switch (simple) {
            case "NonNull":
            case "NotNull":
            case "Nonnull":
                return NONNULL;
            case "Nullable":
                return NULLABLE;
            default:
                return null;
        }
    }
}
