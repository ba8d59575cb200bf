package com.apisurface.signature.ordering;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.format.OverloadedMethodOrder;
import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.ClassKind;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.MemberKind;
import com.apisurface.signature.model.ParameterItem;
import com.apisurface.signature.model.TypeReference;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class SignatureOrderingTest {

    private static MemberItem method(String name, String... parameterTypes) {
        MemberItem.MemberItemBuilder builder = MemberItem.builder()
                .kind(MemberKind.METHOD)
                .name(name)
                .type(TypeReference.primitive("void"));
        for (String type : parameterTypes) {
            builder.parameter(ParameterItem.of(null, TypeReference.isPrimitiveName(type)
                    ? TypeReference.primitive(type)
                    : TypeReference.classType(type)));
        }
        return builder.build();
    }

    private static MemberItem member(MemberKind kind, String name) {
        return MemberItem.builder().kind(kind).name(name).type(TypeReference.primitive("int")).build();
    }

    private static List<String> keys(List<MemberItem> members) {
        return members.stream().map(MemberItem::signatureKey).collect(Collectors.toList());
    }

    @Test
    void testMembersGroupedByKind() {
        List<MemberItem> members = List.of(
                member(MemberKind.ENUM_CONSTANT, "A"),
                member(MemberKind.PROPERTY, "p"),
                member(MemberKind.FIELD, "f"),
                method("m"),
                MemberItem.builder().kind(MemberKind.CONSTRUCTOR).name("Foo").build());

        List<MemberItem> sorted = SignatureOrdering.sortedMembers(members, FormatVersion.V2.defaults());

        assertThat(keys(sorted)).containsExactly("ctor Foo()", "method m()", "field f", "property p",
                "enum_constant A");
    }

    @Test
    void testOverloadsBySignature() {
        List<MemberItem> members = List.of(
                method("m", "java.lang.String"),
                method("m", "int", "int"),
                method("m", "int"));

        List<MemberItem> sorted = SignatureOrdering.sortedMembers(members, FormatVersion.V2.defaults());

        assertThat(keys(sorted)).containsExactly("method m(int)", "method m(java.lang.String)", "method m(int,int)");
    }

    @Test
    void testOverloadsInSourceOrderKeepDeclarationOrder() {
        FileFormat format = FormatVersion.V2.defaults().toBuilder()
                .overloadedMethodOrder(OverloadedMethodOrder.SOURCE)
                .build();
        List<MemberItem> members = List.of(
                method("m", "java.lang.String"),
                method("b"),
                method("m", "int"));

        List<MemberItem> sorted = SignatureOrdering.sortedMembers(members, format);

        assertThat(keys(sorted)).containsExactly("method b()", "method m(java.lang.String)", "method m(int)");
    }

    @Test
    void testSortWholeExtendsList() {
        ClassItem cls = ClassItem.builder()
                .packageName("test.pkg")
                .fullName("Multi")
                .kind(ClassKind.INTERFACE)
                .interfaceType(TypeReference.classType("test.pkg.Zeta"))
                .interfaceType(TypeReference.classType("test.pkg.Alpha"))
                .build();

        FileFormat sortAll = FormatVersion.V5.defaults().withProperty("sort-whole-extends-list", "yes");

        assertThat(SignatureOrdering.orderedInterfaces(cls, FormatVersion.V5.defaults()))
                .extracting(TypeReference::getName)
                .containsExactly("test.pkg.Zeta", "test.pkg.Alpha");
        assertThat(SignatureOrdering.orderedInterfaces(cls, sortAll))
                .extracting(TypeReference::getName)
                .containsExactly("test.pkg.Alpha", "test.pkg.Zeta");
    }
}
