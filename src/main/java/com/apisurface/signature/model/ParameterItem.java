package com.apisurface.signature.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ParameterItem {

    /**
     * Public name, or null when the parameter has none.
     */
    String name;

    @NonNull
    TypeReference type;

    @NonNull
    @Builder.Default
    ModifierSet modifiers = ModifierSet.empty();

    /**
     * True when the parameter declares a default value, written as {@code optional}.
     */
    boolean optional;

    /**
     * Default value source copied verbatim, or null when unknown or absent.
     */
    String defaultValue;

    public static ParameterItem of(String name, TypeReference type) {
        return ParameterItem.builder().name(name).type(type).build();
    }

    public boolean isVarargs() {
        return type.isArray() && type.isVarargs();
    }
}
