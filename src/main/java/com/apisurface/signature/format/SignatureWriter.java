package com.apisurface.signature.format;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.ClassKind;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.MemberKind;
import com.apisurface.signature.model.PackageItem;
import com.apisurface.signature.model.ParameterItem;
import com.apisurface.signature.model.TypeReference;
import com.apisurface.signature.ordering.SignatureOrdering;

/**
 * Renders a {@link Codebase} as signature text.
 *
 * Output is fully determined by the codebase and the format: packages, classes and
 * members are emitted in {@link SignatureOrdering} order regardless of the order they
 * are held in. Packages without classes are skipped.
 */
public class SignatureWriter {
    private static final Logger log = LoggerFactory.getLogger(SignatureWriter.class);

    private final FileFormat format;
    private final TypeRenderer types;
    private final ModifierWriter modifiers;

    public SignatureWriter(FileFormat format) {
        this.format = format;
        this.types = new TypeRenderer(format);
        this.modifiers = new ModifierWriter(format);
    }

    /**
     * Writes the codebase using the format it carries.
     */
    public static String write(Codebase codebase) {
        return new SignatureWriter(codebase.getFormat()).writeCodebase(codebase);
    }

    public String writeCodebase(Codebase codebase) {
        StringBuilder sb = new StringBuilder(format.header());
        int written = 0;
        for (PackageItem pkg : SignatureOrdering.sortedPackages(codebase.getPackages())) {
            if (pkg.isEmpty()) {
                continue;
            }
            writePackage(sb, pkg);
            written++;
        }
        log.debug("Wrote {} package(s) in format {}", written, format.specifier());
        return sb.toString();
    }

    private void writePackage(StringBuilder sb, PackageItem pkg) {
        sb.append("package ")
                .append(modifiers.writePackageAnnotations(pkg.getModifiers()))
                .append(pkg.getName())
                .append(" {\n\n");
        List<ClassItem> classes = pkg.allClasses().collect(Collectors.toCollection(ArrayList::new));
        classes.sort(SignatureOrdering.CLASS_ORDER);
        for (ClassItem cls : classes) {
            writeClass(sb, cls);
        }
        sb.append("}\n\n");
    }

    private void writeClass(StringBuilder sb, ClassItem cls) {
        sb.append("  ")
                .append(modifiers.writeClassModifiers(cls))
                .append(cls.getKind().getKeyword())
                .append(' ')
                .append(cls.getFullName())
                .append(types.renderTypeParameters(cls.getTypeParameters()));
        writeSuperclass(sb, cls);
        writeInterfaces(sb, cls);
        sb.append(" {\n");
        for (MemberItem member : SignatureOrdering.sortedMembers(cls.getMembers(), format)) {
            sb.append("    ");
            writeMember(sb, cls, member);
            sb.append('\n');
        }
        sb.append("  }\n\n");
    }

    private void writeSuperclass(StringBuilder sb, ClassItem cls) {
        TypeReference superclass = cls.getSuperclass();
        if (superclass == null || superclass.isJavaLangObject() || cls.getKind() != ClassKind.CLASS) {
            return;
        }
        sb.append(" extends ").append(types.renderSupertype(superclass));
    }

    private void writeInterfaces(StringBuilder sb, ClassItem cls) {
        if (cls.isAnnotationType() || cls.getInterfaces().isEmpty()) {
            return;
        }
        sb.append(cls.isInterface() ? " extends" : " implements");
        for (TypeReference type : SignatureOrdering.orderedInterfaces(cls, format)) {
            sb.append(' ').append(types.renderSupertype(type));
        }
    }

    /**
     * Writes one member declaration without indentation or line terminator.
     */
    public String writeMember(ClassItem owner, MemberItem member) {
        StringBuilder sb = new StringBuilder();
        writeMember(sb, owner, member);
        return sb.toString();
    }

    private void writeMember(StringBuilder sb, ClassItem owner, MemberItem member) {
        sb.append(member.getKind().getKeyword())
                .append(' ')
                .append(modifiers.writeMemberModifiers(owner, member));
        if (member.isCallable()) {
            writeCallable(sb, member);
        } else {
            writeVariable(sb, member);
        }
    }

    private void writeCallable(StringBuilder sb, MemberItem member) {
        String typeParameters = types.renderTypeParameters(member.getTypeParameters());
        if (!typeParameters.isEmpty()) {
            sb.append(typeParameters).append(' ');
        }
        boolean kotlinOrder = format.isKotlinNameTypeOrder() && member.getKind() == MemberKind.METHOD;
        if (member.getKind() == MemberKind.METHOD && !kotlinOrder) {
            sb.append(types.render(member.getType())).append(' ');
        }
        sb.append(member.getName());
        writeParameters(sb, member.getParameters());
        if (kotlinOrder) {
            sb.append(": ").append(types.render(member.getType()));
        }
        if (!member.getThrownTypes().isEmpty()) {
            sb.append(" throws ").append(member.getThrownTypes().stream()
                    .sorted(Comparator.comparing(TypeReference::toCanonicalString))
                    .map(types::renderSupertype)
                    .collect(Collectors.joining(", ")));
        }
        if (member.getAnnotationDefault() != null) {
            sb.append(" default ").append(member.getAnnotationDefault());
        }
        sb.append(';');
    }

    private void writeParameters(StringBuilder sb, List<ParameterItem> parameters) {
        sb.append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            ParameterItem parameter = parameters.get(i);
            boolean writeDefault = parameter.isOptional() && format.isIncludeDefaultParameterValues();
            if (writeDefault) {
                sb.append("optional ");
            }
            sb.append(modifiers.writeParameterModifiers(parameter.getModifiers(), parameter.getType()));
            if (format.isKotlinNameTypeOrder()) {
                sb.append(parameter.getName() == null ? "_" : parameter.getName())
                        .append(": ")
                        .append(types.render(parameter.getType()));
            } else {
                sb.append(types.render(parameter.getType()));
                if (parameter.getName() != null) {
                    sb.append(' ').append(parameter.getName());
                }
            }
            if (writeDefault && !format.isConciseDefaultValues() && parameter.getDefaultValue() != null) {
                sb.append(" = ").append(parameter.getDefaultValue());
            }
        }
        sb.append(')');
    }

    private void writeVariable(StringBuilder sb, MemberItem member) {
        if (format.isKotlinNameTypeOrder()) {
            sb.append(member.getName()).append(": ").append(types.render(member.getType()));
        } else {
            sb.append(types.render(member.getType())).append(' ').append(member.getName());
        }
        Object value = member.getConstantValue();
        if (value != null && member.getKind() == MemberKind.FIELD) {
            sb.append(" = ").append(ConstantValueRenderer.literal(value)).append(';');
            String comment = ConstantValueRenderer.comment(value);
            if (comment != null) {
                sb.append(" // ").append(comment);
            }
            return;
        }
        sb.append(';');
    }
}
