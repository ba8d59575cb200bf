package com.apisurface.signature.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A declared type parameter with its upper bounds.
 */
@Value
@Builder(toBuilder = true)
public class TypeParameterItem {

    @NonNull
    String name;

    /**
     * Explicit upper bounds. An implicit {@code java.lang.Object} bound is never stored.
     */
    @Singular
    List<TypeReference> bounds;

    public static TypeParameterItem of(String name, TypeReference... bounds) {
        return TypeParameterItem.builder().name(name).bounds(List.of(bounds)).build();
    }

    public String toCanonicalString() {
        if (bounds.isEmpty()) {
            return name;
        }
        return name + " extends " + bounds.stream()
                .map(TypeReference::toCanonicalString)
                .collect(Collectors.joining(" & "));
    }
}
