package com.apisurface.signature.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ClassItemTest {

    private static MemberItem ctor(Visibility visibility) {
        return MemberItem.builder()
                .kind(MemberKind.CONSTRUCTOR)
                .name("Foo")
                .modifiers(ModifierSet.of(visibility))
                .build();
    }

    private static ClassItem.ClassItemBuilder foo() {
        return ClassItem.builder()
                .packageName("test.pkg")
                .fullName("Foo")
                .kind(ClassKind.CLASS)
                .modifiers(ModifierSet.of(Visibility.PUBLIC));
    }

    @Test
    void testClassWithPublicConstructorIsExtensible() {
        assertThat(foo().member(ctor(Visibility.PUBLIC)).build().isExtensibleByClients()).isTrue();
        assertThat(foo().member(ctor(Visibility.PROTECTED)).build().isExtensibleByClients()).isTrue();
    }

    @Test
    void testClassWithoutAccessibleConstructorIsNotExtensible() {
        assertThat(foo().build().isExtensibleByClients()).isFalse();
        assertThat(foo().member(ctor(Visibility.PACKAGE_PRIVATE)).build().isExtensibleByClients()).isFalse();
    }

    @Test
    void testFinalClassIsNotExtensible() {
        ClassItem cls = foo()
                .modifiers(ModifierSet.of(Visibility.PUBLIC, Modifier.FINAL))
                .member(ctor(Visibility.PUBLIC))
                .build();

        assertThat(cls.isExtensibleByClients()).isFalse();
    }

    @Test
    void testInterfaceIsExtensibleUnlessSealed() {
        ClassItem open = foo().kind(ClassKind.INTERFACE).build();
        ClassItem sealed = foo().kind(ClassKind.INTERFACE)
                .modifiers(ModifierSet.of(Visibility.PUBLIC, Modifier.SEALED))
                .build();

        assertThat(open.isExtensibleByClients()).isTrue();
        assertThat(sealed.isExtensibleByClients()).isFalse();
    }

    @Test
    void testNestedClassLookup() {
        ClassItem inner = ClassItem.builder()
                .packageName("test.pkg")
                .fullName("Foo.Inner")
                .kind(ClassKind.CLASS)
                .build();
        ClassItem outer = foo().nestedClass(inner).build();
        Codebase codebase = Codebase.builder()
                .pkg(PackageItem.builder().name("test.pkg").cls(outer).build())
                .build();

        assertThat(inner.isNested()).isTrue();
        assertThat(inner.simpleName()).isEqualTo("Inner");
        assertThat(inner.qualifiedName()).isEqualTo("test.pkg.Foo.Inner");
        assertThat(codebase.findClass("test.pkg.Foo.Inner")).isSameAs(inner);
        assertThat(codebase.findClass("test.pkg.Missing")).isNull();
        assertThat(codebase.classIndex()).containsOnlyKeys("test.pkg.Foo", "test.pkg.Foo.Inner");
    }

    @Test
    void testVisibilityOrdering() {
        assertThat(Visibility.PROTECTED.isNarrowerThan(Visibility.PUBLIC)).isTrue();
        assertThat(Visibility.PACKAGE_PRIVATE.isNarrowerThan(Visibility.PROTECTED)).isTrue();
        assertThat(Visibility.PUBLIC.isNarrowerThan(Visibility.PUBLIC)).isFalse();
    }
}
