package com.apisurface.signature.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A constructor, method, field, property or enum constant.
 *
 * One shape for every kind: attributes that do not apply to a kind are left empty
 * (a constructor has no type, a field no parameters).
 */
@Value
@Builder(toBuilder = true)
public class MemberItem {

    @NonNull
    MemberKind kind;

    /**
     * Simple name. For constructors this is the class name as written, e.g. {@code Outer.Inner}.
     */
    @NonNull
    String name;

    @NonNull
    @Builder.Default
    ModifierSet modifiers = ModifierSet.empty();

    /**
     * Return type of a method, declared type of a field, property or enum constant.
     * Null for constructors.
     */
    TypeReference type;

    @Singular
    List<TypeParameterItem> typeParameters;

    @Singular
    List<ParameterItem> parameters;

    @Singular
    List<TypeReference> thrownTypes;

    /**
     * Compile-time constant of a field, boxed (Integer, Long, Character, String, ...).
     */
    Object constantValue;

    /**
     * Default value source of an annotation type method.
     */
    String annotationDefault;

    public boolean isCallable() {
        return kind.isCallable();
    }

    public boolean isConstructor() {
        return kind == MemberKind.CONSTRUCTOR;
    }

    public boolean isMethod() {
        return kind == MemberKind.METHOD;
    }

    public Visibility visibility() {
        return modifiers.getVisibility();
    }

    /**
     * Erased parameter types, comma separated without spaces.
     */
    public String erasedParameterList() {
        return parameters.stream()
                .map(p -> p.getType().toErasedString())
                .collect(Collectors.joining(","));
    }

    /**
     * Identity of this member within its class: kind, name and, for callables, the
     * erased parameter types. Two declarations with equal keys describe the same member.
     */
    public String signatureKey() {
        if (isCallable()) {
            return kind.getKeyword() + " " + name + "(" + erasedParameterList() + ")";
        }
        return kind.getKeyword() + " " + name;
    }

    /**
     * Stable location used by issues and baselines, e.g. {@code test.pkg.Foo#m(int)}.
     */
    public String location(ClassItem owner) {
        String base = owner.qualifiedName() + "#" + (isConstructor() ? owner.simpleName() : name);
        if (!isCallable()) {
            return base;
        }
        return base + "(" + parameters.stream()
                .map(p -> p.getType().toCanonicalString())
                .collect(Collectors.joining(", ")) + ")";
    }

    /**
     * Human readable description, e.g. {@code method test.pkg.Foo.m(int)}.
     */
    public String describe(ClassItem owner) {
        String label = isConstructor() ? "constructor" : kind.getKeyword().replace('_', ' ');
        return label + " " + location(owner).replace('#', '.');
    }
}
