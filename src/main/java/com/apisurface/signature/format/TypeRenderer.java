package com.apisurface.signature.format;

import java.util.List;
import java.util.stream.Collectors;

import com.apisurface.signature.model.AnnotationItem;
import com.apisurface.signature.model.Nullability;
import com.apisurface.signature.model.TypeParameterItem;
import com.apisurface.signature.model.TypeReference;

/**
 * Renders {@link TypeReference}s and type parameter lists as signature text under a
 * given {@link FileFormat}.
 */
public class TypeRenderer {

    private final FileFormat format;

    public TypeRenderer(FileFormat format) {
        this.format = format;
    }

    private static final String JAVA_LANG_PREFIX = "java.lang.";

    /**
     * Renders a member or parameter type, including its nullability suffix when the
     * format uses Kotlin-style nulls. Those formats also write a top-level
     * {@code java.lang} class by its simple name.
     */
    public String render(TypeReference type) {
        String rendered = renderBound(type);
        return format.isKotlinStyleNulls() ? stripJavaLangPrefix(rendered) : rendered;
    }

    private String renderBound(TypeReference type) {
        StringBuilder sb = new StringBuilder();
        append(sb, type, true, false);
        return sb.toString();
    }

    /**
     * Drops a leading {@code java.lang.} unless the name continues into a sub-package
     * or nested class, as in {@code java.lang.annotation.Retention}.
     */
    static String stripJavaLangPrefix(String rendered) {
        if (!rendered.startsWith(JAVA_LANG_PREFIX)) {
            return rendered;
        }
        int start = JAVA_LANG_PREFIX.length();
        int end = start;
        while (end < rendered.length() && Character.isJavaIdentifierPart(rendered.charAt(end))) {
            end++;
        }
        if (end == start || (end < rendered.length() && rendered.charAt(end) == '.'
                && !rendered.startsWith("...", end))) {
            return rendered;
        }
        return rendered.substring(start);
    }

    /**
     * Renders a supertype or thrown type: no suffix on the outermost type.
     */
    public String renderSupertype(TypeReference type) {
        StringBuilder sb = new StringBuilder();
        append(sb, type, false, false);
        return sb.toString();
    }

    /**
     * Renders {@code <T extends Bound, U>}, or an empty string when there are none.
     */
    public String renderTypeParameters(List<TypeParameterItem> typeParameters) {
        if (typeParameters.isEmpty()) {
            return "";
        }
        return typeParameters.stream()
                .map(this::renderTypeParameter)
                .collect(Collectors.joining(",", "<", ">"));
    }

    private String renderTypeParameter(TypeParameterItem typeParameter) {
        if (typeParameter.getBounds().isEmpty()) {
            return typeParameter.getName();
        }
        return typeParameter.getName() + " extends " + typeParameter.getBounds().stream()
                .map(this::renderBound)
                .collect(Collectors.joining(" & "));
    }

    private void append(StringBuilder sb, TypeReference type, boolean withSuffix, boolean nested) {
        if (nested && format.isIncludeTypeUseAnnotations() && type.getKind() != TypeReference.Kind.ARRAY) {
            for (AnnotationItem annotation : type.getAnnotations()) {
                sb.append(annotation.toSource()).append(' ');
            }
        }
        switch (type.getKind()) {
            case PRIMITIVE:
                sb.append(type.getName());
                return;
            case VARIABLE:
                sb.append(type.getName());
                break;
            case WILDCARD:
                sb.append('?');
                if (type.getWildcardBound() != TypeReference.WildcardBound.NONE) {
                    sb.append(' ').append(type.getWildcardBound().name().toLowerCase()).append(' ');
                    append(sb, type.getBound(), true, true);
                }
                return;
            case ARRAY:
                append(sb, type.getComponentType(), true, true);
                sb.append(type.isVarargs() ? "..." : "[]");
                break;
            case CLASS:
            default:
                appendClass(sb, type);
                break;
        }
        if (withSuffix) {
            sb.append(nullabilitySuffix(type.getNullability()));
        }
    }

    private void appendClass(StringBuilder sb, TypeReference type) {
        if (type.getOuterType() != null) {
            append(sb, type.getOuterType(), false, false);
            sb.append('.').append(type.getName().substring(type.getOuterType().getName().length() + 1));
        } else {
            sb.append(type.getName());
        }
        if (!type.getArguments().isEmpty()) {
            sb.append('<');
            for (int i = 0; i < type.getArguments().size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                append(sb, type.getArguments().get(i), true, true);
            }
            sb.append('>');
        }
    }

    private String nullabilitySuffix(Nullability nullability) {
        if (!format.isKotlinStyleNulls()) {
            return "";
        }
        switch (nullability) {
            case NULLABLE:
                return "?";
            case NONNULL:
                return "";
            default:
                return "!";
        }
    }
}
