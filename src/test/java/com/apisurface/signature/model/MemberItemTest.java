package com.apisurface.signature.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MemberItemTest {

    private static final ClassItem FOO = ClassItem.builder()
            .packageName("test.pkg")
            .fullName("Foo")
            .kind(ClassKind.CLASS)
            .build();

    @Test
    void testSignatureKeyUsesErasedParameterTypes() {
        MemberItem method = MemberItem.builder()
                .kind(MemberKind.METHOD)
                .name("put")
                .type(TypeReference.primitive("void"))
                .parameter(ParameterItem.of("values", TypeReference.classType("java.util.List",
                        TypeReference.classType("java.lang.String"))))
                .parameter(ParameterItem.of("rest", TypeReference.varargsOf(TypeReference.primitive("int"))))
                .build();

        assertThat(method.signatureKey()).isEqualTo("method put(java.util.List,int[])");
        assertThat(method.erasedParameterList()).isEqualTo("java.util.List,int[]");
    }

    @Test
    void testLocationOfMethodAndConstructor() {
        MemberItem method = MemberItem.builder()
                .kind(MemberKind.METHOD)
                .name("m")
                .type(TypeReference.primitive("void"))
                .parameter(ParameterItem.of(null, TypeReference.primitive("int")))
                .parameter(ParameterItem.of(null, TypeReference.classType("java.lang.String")))
                .build();
        MemberItem ctor = MemberItem.builder()
                .kind(MemberKind.CONSTRUCTOR)
                .name("Foo")
                .build();

        assertThat(method.location(FOO)).isEqualTo("test.pkg.Foo#m(int, java.lang.String)");
        assertThat(ctor.location(FOO)).isEqualTo("test.pkg.Foo#Foo()");
        assertThat(method.describe(FOO)).isEqualTo("method test.pkg.Foo.m(int, java.lang.String)");
        assertThat(ctor.describe(FOO)).isEqualTo("constructor test.pkg.Foo.Foo()");
    }

    @Test
    void testFieldLocationHasNoParameterList() {
        MemberItem field = MemberItem.builder()
                .kind(MemberKind.FIELD)
                .name("X")
                .type(TypeReference.primitive("int"))
                .build();

        assertThat(field.location(FOO)).isEqualTo("test.pkg.Foo#X");
        assertThat(field.signatureKey()).isEqualTo("field X");
        assertThat(field.isCallable()).isFalse();
    }
}
