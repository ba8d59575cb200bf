package com.apisurface.signature.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Structural description of a type occurrence.
 *
 * References are name based: a class type records the qualified name of the class
 * and is never resolved to a {@link ClassItem} by the model itself.
 */
@Value
@Builder(toBuilder = true)
public class TypeReference {

    public enum Kind {
        PRIMITIVE,
        CLASS,
        VARIABLE,
        ARRAY,
        WILDCARD
    }

    public enum WildcardBound {
        NONE,
        EXTENDS,
        SUPER
    }

    public static final String JAVA_LANG_OBJECT = "java.lang.Object";

    private static final List<String> PRIMITIVES =
            List.of("boolean", "byte", "char", "short", "int", "long", "float", "double", "void");

    @NonNull
    Kind kind;

    /**
     * Qualified class name, primitive keyword or type variable name. Unused for arrays and wildcards.
     */
    String name;

    @Singular
    List<TypeReference> arguments;

    /**
     * Parameterized outer type for member types written as {@code Outer<T>.Inner}.
     */
    TypeReference outerType;

    TypeReference componentType;

    /**
     * Only meaningful for the outermost array type of a trailing parameter.
     */
    boolean varargs;

    @NonNull
    @Builder.Default
    WildcardBound wildcardBound = WildcardBound.NONE;

    TypeReference bound;

    @NonNull
    @Builder.Default
    Nullability nullability = Nullability.PLATFORM;

    /**
     * Type-use annotations. Only kept on nested positions (type arguments, array
     * components, wildcard bounds); annotations on a top-level type belong to the item.
     */
    @Singular
    List<AnnotationItem> annotations;

    public static boolean isPrimitiveName(String name) {
        return PRIMITIVES.contains(name);
    }

    public static TypeReference primitive(String name) {
        return TypeReference.builder().kind(Kind.PRIMITIVE).name(name).nullability(Nullability.NONNULL).build();
    }

    public static TypeReference classType(String name, TypeReference... arguments) {
        return TypeReference.builder().kind(Kind.CLASS).name(name).arguments(List.of(arguments)).build();
    }

    public static TypeReference variable(String name) {
        return TypeReference.builder().kind(Kind.VARIABLE).name(name).build();
    }

    public static TypeReference arrayOf(TypeReference component) {
        return TypeReference.builder().kind(Kind.ARRAY).componentType(component).build();
    }

    public static TypeReference varargsOf(TypeReference component) {
        return TypeReference.builder().kind(Kind.ARRAY).componentType(component).varargs(true).build();
    }

    public static TypeReference wildcard() {
        return TypeReference.builder().kind(Kind.WILDCARD).build();
    }

    public static TypeReference wildcard(WildcardBound wildcardBound, TypeReference bound) {
        return TypeReference.builder().kind(Kind.WILDCARD).wildcardBound(wildcardBound).bound(bound).build();
    }

    public TypeReference withNullability(Nullability newNullability) {
        if (kind == Kind.PRIMITIVE || kind == Kind.WILDCARD || nullability == newNullability) {
            return this;
        }
        return toBuilder().nullability(newNullability).build();
    }

    /**
     * Applies the given nullability to this type and every nested position.
     */
    public TypeReference withNullabilityDeep(Nullability newNullability) {
        TypeReferenceBuilder builder = withNullability(newNullability).toBuilder();
        if (!arguments.isEmpty()) {
            builder.clearArguments();
            arguments.forEach(a -> builder.argument(a.withNullabilityDeep(newNullability)));
        }
        if (componentType != null) {
            builder.componentType(componentType.withNullabilityDeep(newNullability));
        }
        if (bound != null) {
            builder.bound(bound.withNullabilityDeep(newNullability));
        }
        if (outerType != null) {
            builder.outerType(outerType.withNullabilityDeep(newNullability));
        }
        return builder.build();
    }

    public boolean isPrimitive() {
        return kind == Kind.PRIMITIVE;
    }

    public boolean isVoid() {
        return kind == Kind.PRIMITIVE && "void".equals(name);
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    public boolean isJavaLangObject() {
        return kind == Kind.CLASS && JAVA_LANG_OBJECT.equals(name) && arguments.isEmpty();
    }

    /**
     * Full type text without nullability or annotations, e.g.
     * {@code java.util.Map<K,java.util.List<? extends V>>[]}.
     */
    public String toCanonicalString() {
        switch (kind) {
            case PRIMITIVE:
            case VARIABLE:
                return name;
            case ARRAY:
                return componentType.toCanonicalString() + (varargs ? "..." : "[]");
            case WILDCARD:
                if (wildcardBound == WildcardBound.NONE) {
                    return "?";
                }
                return "? " + wildcardBound.name().toLowerCase() + " " + bound.toCanonicalString();
            case CLASS:
            default:
                String base = outerType == null
                        ? name
                        : outerType.toCanonicalString() + "." + name.substring(outerType.getName().length() + 1);
                if (arguments.isEmpty()) {
                    return base;
                }
                return base + arguments.stream()
                        .map(TypeReference::toCanonicalString)
                        .collect(Collectors.joining(",", "<", ">"));
        }
    }

    /**
     * Erased form used to identify callables: type arguments dropped and varargs
     * treated as arrays.
     */
    public String toErasedString() {
        switch (kind) {
            case ARRAY:
                return componentType.toErasedString() + "[]";
            case WILDCARD:
                return bound == null ? JAVA_LANG_OBJECT : bound.toErasedString();
            default:
                return name;
        }
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
