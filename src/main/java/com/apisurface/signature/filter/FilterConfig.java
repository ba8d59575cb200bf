package com.apisurface.signature.filter;

import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Selects the part of a codebase that forms the API surface.
 */
@Value
@Builder(toBuilder = true)
public class FilterConfig {

    /**
     * When not empty, only items carrying one of these annotations (or declared inside
     * a class or package carrying one) are part of the surface.
     */
    @Singular
    Set<String> showAnnotations;

    /**
     * Items carrying one of these annotations are removed, with everything they contain.
     */
    @Singular
    Set<String> hideAnnotations;

    /**
     * Package name prefixes to remove; {@code com.foo} also removes {@code com.foo.bar}.
     */
    @Singular
    Set<String> hidePackages;

    public static FilterConfig none() {
        return FilterConfig.builder().build();
    }

    public boolean isEmpty() {
        return showAnnotations.isEmpty() && hideAnnotations.isEmpty() && hidePackages.isEmpty();
    }

    public boolean isPackageHidden(String packageName) {
        return hidePackages.stream()
                .anyMatch(prefix -> packageName.equals(prefix) || packageName.startsWith(prefix + "."));
    }
}
