package com.apisurface.signature.compat;

import java.util.Set;

import com.apisurface.signature.model.Codebase;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Policy knobs of a compatibility check.
 */
@Value
@Builder(toBuilder = true)
public class CompatibilityConfig {

    public static final String DEFAULT_SUPPRESSION_ANNOTATION = "SuppressCompatibility";

    /**
     * Annotations whose addition or removal is an incompatible change.
     */
    @Singular
    Set<String> compatibilityAnnotations;

    /**
     * Items carrying this annotation, or nested in one, are not checked.
     */
    @NonNull
    @Builder.Default
    String suppressionAnnotation = DEFAULT_SUPPRESSION_ANNOTATION;

    /**
     * Previously released removed API; items missing from the new codebase but listed
     * here are intentional removals. May be null.
     */
    Codebase removedApi;

    @NonNull
    @Builder.Default
    IssueConfiguration issueConfiguration = new IssueConfiguration();

    @NonNull
    @Builder.Default
    Baseline baseline = Baseline.empty();

    public static CompatibilityConfig defaults() {
        return CompatibilityConfig.builder().build();
    }
}
