package com.apisurface.signature.model;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A class, interface, enum, annotation type or record, together with its members and
 * nested classes.
 */
@Value
@Builder(toBuilder = true)
public class ClassItem {

    @NonNull
    String packageName;

    /**
     * Name relative to the package; nested classes use dotted form, e.g. {@code Outer.Inner}.
     */
    @NonNull
    String fullName;

    @NonNull
    ClassKind kind;

    @NonNull
    @Builder.Default
    ModifierSet modifiers = ModifierSet.empty();

    @Singular
    List<TypeParameterItem> typeParameters;

    /**
     * Null for interfaces, annotation types, enums and classes extending {@code java.lang.Object}.
     */
    TypeReference superclass;

    @Singular("interfaceType")
    List<TypeReference> interfaces;

    /**
     * Members in declaration order as read or built.
     */
    @Singular
    List<MemberItem> members;

    @Singular
    List<ClassItem> nestedClasses;

    public String qualifiedName() {
        return packageName.isEmpty() ? fullName : packageName + "." + fullName;
    }

    public String simpleName() {
        return fullName.substring(fullName.lastIndexOf('.') + 1);
    }

    public boolean isNested() {
        return fullName.indexOf('.') >= 0;
    }

    public boolean isInterface() {
        return kind == ClassKind.INTERFACE;
    }

    public boolean isAnnotationType() {
        return kind == ClassKind.ANNOTATION;
    }

    public boolean isEnum() {
        return kind == ClassKind.ENUM;
    }

    public List<MemberItem> membersOfKind(MemberKind memberKind) {
        return members.stream().filter(m -> m.getKind() == memberKind).collect(Collectors.toList());
    }

    public List<MemberItem> constructors() {
        return membersOfKind(MemberKind.CONSTRUCTOR);
    }

    public List<MemberItem> methods() {
        return membersOfKind(MemberKind.METHOD);
    }

    public List<MemberItem> fields() {
        return membersOfKind(MemberKind.FIELD);
    }

    public MemberItem findMember(String signatureKey) {
        for (MemberItem member : members) {
            if (member.signatureKey().equals(signatureKey)) {
                return member;
            }
        }
        return null;
    }

    public List<MemberItem> findMethods(String name) {
        return members.stream()
                .filter(m -> m.isMethod() && m.getName().equals(name))
                .collect(Collectors.toList());
    }

    public ClassItem findNestedClass(String nestedFullName) {
        for (ClassItem nested : nestedClasses) {
            if (nested.getFullName().equals(nestedFullName)) {
                return nested;
            }
            if (nestedFullName.startsWith(nested.getFullName() + ".")) {
                return nested.findNestedClass(nestedFullName);
            }
        }
        return null;
    }

    /**
     * True when code outside the API could create a subclass: the class is not final
     * and declares at least one accessible constructor (or none at all for interfaces).
     */
    public boolean isExtensibleByClients() {
        if (modifiers.isFinal() || modifiers.has(Modifier.SEALED)) {
            return false;
        }
        if (kind.isInterfaceLike()) {
            return true;
        }
        if (kind != ClassKind.CLASS) {
            return false;
        }
        return constructors().stream()
                .anyMatch(c -> c.visibility().getLevel() >= Visibility.PROTECTED.getLevel());
    }

    /**
     * This class followed by all nested classes, depth first.
     */
    public Stream<ClassItem> selfAndNested() {
        return Stream.concat(Stream.of(this), nestedClasses.stream().flatMap(ClassItem::selfAndNested));
    }

    public TypeReference asType() {
        return TypeReference.builder()
                .kind(TypeReference.Kind.CLASS)
                .name(qualifiedName())
                .build();
    }
}
