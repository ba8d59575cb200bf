package com.apisurface.signature.parser;

import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.model.AnnotationItem;
import com.apisurface.signature.model.Nullability;
import com.apisurface.signature.model.TypeParameterItem;
import com.apisurface.signature.model.TypeReference;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class TypeReferenceParserTest {

    private final TypeReferenceParser kotlinNulls = new TypeReferenceParser(FormatVersion.V3.defaults(), Set.of("T"));
    private final TypeReferenceParser javaNulls = new TypeReferenceParser(FormatVersion.V2.defaults(), Set.of("T"));

    @Test
    void testNestedGenericType() {
        TypeReference type = kotlinNulls.parse("java.util.Map<T,java.util.List<? extends java.lang.Number>>?");

        assertThat(type.getKind()).isEqualTo(TypeReference.Kind.CLASS);
        assertThat(type.getNullability()).isEqualTo(Nullability.NULLABLE);
        assertThat(type.getArguments().get(0).getKind()).isEqualTo(TypeReference.Kind.VARIABLE);
        assertThat(type.toCanonicalString()).isEqualTo("java.util.Map<T,java.util.List<? extends java.lang.Number>>");
        assertThat(type.toErasedString()).isEqualTo("java.util.Map");
    }

    @Test
    void testNullabilitySuffixes() {
        assertThat(kotlinNulls.parse("java.lang.String").getNullability()).isEqualTo(Nullability.NONNULL);
        assertThat(kotlinNulls.parse("java.lang.String!").getNullability()).isEqualTo(Nullability.PLATFORM);
        assertThat(javaNulls.parse("java.lang.String").getNullability()).isEqualTo(Nullability.PLATFORM);
    }

    @Test
    void testArraysAndVarargs() {
        TypeReference array = kotlinNulls.parse("int[][]?");
        TypeReference varargs = kotlinNulls.parse("java.lang.String...");

        assertThat(array.isArray()).isTrue();
        assertThat(array.getNullability()).isEqualTo(Nullability.NULLABLE);
        assertThat(array.toCanonicalString()).isEqualTo("int[][]");
        assertThat(varargs.isVarargs()).isTrue();
        assertThat(varargs.toCanonicalString()).isEqualTo("java.lang.String...");
        assertThat(varargs.toErasedString()).isEqualTo("java.lang.String[]");
    }

    @Test
    void testInnerClassOfParameterizedType() {
        TypeReference type = kotlinNulls.parse("test.pkg.Outer<T>.Inner<java.lang.String>");

        assertThat(type.getName()).isEqualTo("test.pkg.Outer.Inner");
        assertThat(type.getOuterType().getName()).isEqualTo("test.pkg.Outer");
        assertThat(type.toCanonicalString()).isEqualTo("test.pkg.Outer<T>.Inner<java.lang.String>");
    }

    @Test
    void testBareClassNamesResolveToJavaLang() {
        TypeReference type = kotlinNulls.parse("java.util.Map<String,T>");

        assertThat(kotlinNulls.parse("Object!").getName()).isEqualTo("java.lang.Object");
        assertThat(javaNulls.parse("String[]").toCanonicalString()).isEqualTo("java.lang.String[]");
        assertThat(type.getArguments().get(0).getName()).isEqualTo("java.lang.String");
        assertThat(type.getArguments().get(1).getKind()).isEqualTo(TypeReference.Kind.VARIABLE);
        assertThat(kotlinNulls.parse("E").getName()).isEqualTo("E");
        assertThat(kotlinNulls.parse("test.pkg.Foo").getName()).isEqualTo("test.pkg.Foo");
    }

    @Test
    void testTypeUseAnnotationsOnArguments() {
        TypeReference type = javaNulls.parse("java.util.List<@test.pkg.Tag java.lang.String>");

        assertThat(type.getArguments().get(0).getAnnotations())
                .extracting(AnnotationItem::getQualifiedName)
                .containsExactly("test.pkg.Tag");
    }

    @Test
    void testTypeParameterList() {
        List<TypeParameterItem> parameters = TypeReferenceParser.parseTypeParameters(
                "<K extends java.lang.Comparable<K>, V extends java.lang.Object>", FormatVersion.V2.defaults(), Set.of());

        assertThat(parameters).extracting(TypeParameterItem::getName).containsExactly("K", "V");
        assertThat(parameters.get(0).getBounds().get(0).getArguments().get(0).getKind())
                .isEqualTo(TypeReference.Kind.VARIABLE);
        assertThat(parameters.get(1).getBounds()).isEmpty();
    }

    @Test
    void testAnnotationArguments() {
        AnnotationItem annotation = TypeReferenceParser.parseAnnotation("@IntRange(from=0, to=255)");
        AnnotationItem single = TypeReferenceParser.parseAnnotation("@RequiresApi(21)");

        assertThat(annotation.getAttributes()).containsEntry("from", "0").containsEntry("to", "255");
        assertThat(annotation.toSource()).isEqualTo("@IntRange(from=0, to=255)");
        assertThat(single.getAttributes()).containsEntry("value", "21");
        assertThat(single.toSource()).isEqualTo("@RequiresApi(21)");
    }

    @Test
    void testMalformedTypes() {
        assertThatThrownBy(() -> kotlinNulls.parse("java.util.List<"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> kotlinNulls.parse("Foo>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unexpected");
    }
}
