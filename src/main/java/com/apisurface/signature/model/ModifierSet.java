package com.apisurface.signature.model;

import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Visibility, modifier keywords and annotations of an item.
 */
@Value
@Builder(toBuilder = true)
public class ModifierSet {

    @NonNull
    @Builder.Default
    Visibility visibility = Visibility.PACKAGE_PRIVATE;

    @Singular("flag")
    Set<Modifier> flags;

    @Singular
    List<AnnotationItem> annotations;

    public static ModifierSet empty() {
        return ModifierSet.builder().build();
    }

    public static ModifierSet of(Visibility visibility, Modifier... flags) {
        return ModifierSet.builder().visibility(visibility).flags(List.of(flags)).build();
    }

    public boolean has(Modifier modifier) {
        return flags.contains(modifier);
    }

    public boolean isStatic() {
        return has(Modifier.STATIC);
    }

    public boolean isAbstract() {
        return has(Modifier.ABSTRACT);
    }

    public boolean isFinal() {
        return has(Modifier.FINAL);
    }

    public boolean isDeprecated() {
        return has(Modifier.DEPRECATED);
    }

    public ModifierSet with(Modifier modifier) {
        return has(modifier) ? this : toBuilder().flag(modifier).build();
    }

    public ModifierSet without(Modifier modifier) {
        if (!has(modifier)) {
            return this;
        }
        ModifierSetBuilder builder = toBuilder().clearFlags();
        flags.stream().filter(f -> f != modifier).forEach(builder::flag);
        return builder.build();
    }

    public ModifierSet withVisibility(Visibility newVisibility) {
        return toBuilder().visibility(newVisibility).build();
    }

    public boolean hasAnnotation(String name) {
        return findAnnotation(name) != null;
    }

    public AnnotationItem findAnnotation(String name) {
        for (AnnotationItem annotation : annotations) {
            if (annotation.matches(name)) {
                return annotation;
            }
        }
        return null;
    }

    public boolean hasAnyAnnotation(Set<String> names) {
        return names.stream().anyMatch(this::hasAnnotation);
    }
}
