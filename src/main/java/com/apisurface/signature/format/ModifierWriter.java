package com.apisurface.signature.format;

import java.util.EnumSet;
import java.util.Set;

import com.apisurface.signature.model.AnnotationItem;
import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.ClassKind;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.Modifier;
import com.apisurface.signature.model.ModifierSet;
import com.apisurface.signature.model.Nullability;
import com.apisurface.signature.model.TypeReference;
import com.apisurface.signature.model.Visibility;

/**
 * Writes modifier lists in their fixed order: annotations, visibility, keywords,
 * then {@code deprecated}. Modifiers implied by the declaration's context are left out.
 */
public class ModifierWriter {

    public static final String NULLABLE_ANNOTATION = "Nullable";
    public static final String NONNULL_ANNOTATION = "NonNull";

    /**
     * Implementation details that never appear in a signature file.
     */
    private static final Set<Modifier> NOT_WRITTEN =
            EnumSet.of(Modifier.SYNCHRONIZED, Modifier.NATIVE, Modifier.STRICTFP);

    private final FileFormat format;

    public ModifierWriter(FileFormat format) {
        this.format = format;
    }

    public String writePackageAnnotations(ModifierSet modifiers) {
        StringBuilder sb = new StringBuilder();
        appendAnnotations(sb, modifiers, null);
        return sb.toString();
    }

    public String writeClassModifiers(ClassItem cls) {
        StringBuilder sb = new StringBuilder();
        ModifierSet modifiers = cls.getModifiers();
        appendAnnotations(sb, modifiers, null);
        appendVisibility(sb, modifiers.getVisibility());
        for (Modifier modifier : modifiers.getFlags().stream().sorted().toList()) {
            if (modifier == Modifier.ABSTRACT && cls.getKind() != ClassKind.CLASS) {
                continue;
            }
            if ((modifier == Modifier.STATIC || modifier == Modifier.FINAL) && cls.isEnum()) {
                continue;
            }
            appendKeyword(sb, modifier);
        }
        return sb.toString();
    }

    public String writeMemberModifiers(ClassItem owner, MemberItem member) {
        StringBuilder sb = new StringBuilder();
        ModifierSet modifiers = member.getModifiers();
        appendAnnotations(sb, modifiers, member.getType());
        Visibility visibility = modifiers.getVisibility();
        if (owner.getKind().isInterfaceLike() && visibility == Visibility.PACKAGE_PRIVATE) {
            visibility = Visibility.PUBLIC;
        }
        appendVisibility(sb, visibility);
        boolean interfaceAbstract = owner.getKind() == ClassKind.INTERFACE
                && !modifiers.has(Modifier.DEFAULT)
                && !modifiers.isStatic();
        for (Modifier modifier : modifiers.getFlags().stream().sorted().toList()) {
            if (modifier == Modifier.ABSTRACT && interfaceAbstract) {
                continue;
            }
            appendKeyword(sb, modifier);
        }
        return sb.toString();
    }

    public String writeParameterModifiers(ModifierSet modifiers, TypeReference type) {
        StringBuilder sb = new StringBuilder();
        appendAnnotations(sb, modifiers, type);
        return sb.toString();
    }

    private void appendAnnotations(StringBuilder sb, ModifierSet modifiers, TypeReference type) {
        if (type != null && !format.isKotlinStyleNulls() && !type.isPrimitive()) {
            if (type.getNullability() == Nullability.NULLABLE) {
                sb.append('@').append(NULLABLE_ANNOTATION).append(' ');
            } else if (type.getNullability() == Nullability.NONNULL) {
                sb.append('@').append(NONNULL_ANNOTATION).append(' ');
            }
        }
        for (AnnotationItem annotation : modifiers.getAnnotations()) {
            sb.append(annotation.toSource()).append(' ');
        }
    }

    private void appendVisibility(StringBuilder sb, Visibility visibility) {
        if (!visibility.getKeyword().isEmpty()) {
            sb.append(visibility.getKeyword()).append(' ');
        }
    }

    private void appendKeyword(StringBuilder sb, Modifier modifier) {
        if (!NOT_WRITTEN.contains(modifier)) {
            sb.append(modifier.getKeyword()).append(' ');
        }
    }
}
