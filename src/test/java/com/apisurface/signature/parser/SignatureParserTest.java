package com.apisurface.signature.parser;

import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.ClassKind;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.MemberKind;
import com.apisurface.signature.model.Modifier;
import com.apisurface.signature.model.Nullability;
import com.apisurface.signature.model.ParameterItem;
import com.apisurface.signature.model.TypeReference;
import com.apisurface.signature.model.Visibility;
import com.apisurface.signature.parser.exception.ParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SignatureParser.
 */
class SignatureParserTest {

    private static Codebase parse(String text) {
        return SignatureParser.parse("api.txt", text);
    }

    @Test
    void testParseSimpleClass() {
        Codebase codebase = parse("""
                // Signature format: 2.0
                package test.pkg {
                  public class Foo extends test.pkg.Base implements java.lang.Runnable java.io.Closeable {
                    ctor public Foo();
                    method public void foo(int);
                    field public static final int X = 1; // 0x1
                  }
                }
                """);

        assertThat(codebase.getFormat()).isEqualTo(FormatVersion.V2.defaults());
        assertThat(codebase.getOrigin()).isEqualTo("api.txt");

        ClassItem foo = codebase.findClass("test.pkg.Foo");
        assertThat(foo.getKind()).isEqualTo(ClassKind.CLASS);
        assertThat(foo.getModifiers().getVisibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(foo.getSuperclass().getName()).isEqualTo("test.pkg.Base");
        assertThat(foo.getInterfaces()).extracting(TypeReference::getName)
                .containsExactly("java.lang.Runnable", "java.io.Closeable");
        assertThat(foo.getMembers()).extracting(MemberItem::signatureKey)
                .containsExactly("ctor Foo()", "method foo(int)", "field X");

        MemberItem x = foo.findMember("field X");
        assertThat(x.getConstantValue()).isEqualTo(1);
        assertThat(x.getModifiers().isStatic()).isTrue();
        assertThat(x.getModifiers().isFinal()).isTrue();
    }

    @Test
    void testObjectSuperclassIsDropped() {
        Codebase codebase = parse("""
                package test.pkg {
                  public class Foo extends java.lang.Object {
                  }
                }
                """);

        assertThat(codebase.findClass("test.pkg.Foo").getSuperclass()).isNull();
    }

    @Test
    void testImpliedModifiers() {
        Codebase codebase = parse("""
                // Signature format: 2.0
                package test.pkg {
                  public interface Api {
                    method public void run();
                    method public default void reset();
                    method public static test.pkg.Api create();
                  }
                  public enum Mode {
                  }
                  public class Outer {
                  }
                  public enum Outer.Kind {
                  }
                }
                """);

        ClassItem api = codebase.findClass("test.pkg.Api");
        assertThat(api.getModifiers().isAbstract()).isTrue();
        assertThat(api.findMember("method run()").getModifiers().isAbstract()).isTrue();
        assertThat(api.findMember("method reset()").getModifiers().isAbstract()).isFalse();
        assertThat(api.findMember("method create()").getModifiers().isAbstract()).isFalse();

        assertThat(codebase.findClass("test.pkg.Mode").getModifiers().getFlags()).containsExactly(Modifier.FINAL);
        assertThat(codebase.findClass("test.pkg.Outer.Kind").getModifiers().getFlags())
                .containsExactlyInAnyOrder(Modifier.FINAL, Modifier.STATIC);
    }

    @Test
    void testNestedClassesAttachToOuterClass() {
        Codebase codebase = parse("""
                package test.pkg {
                  public class Outer {
                  }
                  public static class Outer.Inner {
                  }
                  public static class Outer.Inner.Deep {
                  }
                }
                """);

        assertThat(codebase.findPackage("test.pkg").getClasses()).hasSize(1);
        ClassItem outer = codebase.findClass("test.pkg.Outer");
        assertThat(outer.getNestedClasses()).extracting(ClassItem::getFullName).containsExactly("Outer.Inner");
        assertThat(codebase.findClass("test.pkg.Outer.Inner.Deep")).isNotNull();
    }

    @Test
    void testTypeVariablesResolvedFromClassAndMethod() {
        Codebase codebase = parse("""
                package test.pkg {
                  public class Box<T extends java.lang.Comparable<T>> {
                    method public T get();
                    method public <R> R map(java.util.function.Function<? super T, ? extends R>);
                  }
                  public class Box.Entry {
                    method public T value();
                  }
                }
                """);

        ClassItem box = codebase.findClass("test.pkg.Box");
        assertThat(box.getTypeParameters()).hasSize(1);
        assertThat(box.getTypeParameters().get(0).getBounds().get(0).toCanonicalString())
                .isEqualTo("java.lang.Comparable<T>");
        assertThat(box.findMember("method get()").getType().getKind()).isEqualTo(TypeReference.Kind.VARIABLE);

        MemberItem map = box.findMember("method map(java.util.function.Function)");
        assertThat(map.getTypeParameters()).hasSize(1);
        assertThat(map.getType().getKind()).isEqualTo(TypeReference.Kind.VARIABLE);
        assertThat(map.getParameters().get(0).getType().toCanonicalString())
                .isEqualTo("java.util.function.Function<? super T,? extends R>");

        MemberItem value = codebase.findClass("test.pkg.Box.Entry").findMember("method value()");
        assertThat(value.getType().getKind()).isEqualTo(TypeReference.Kind.VARIABLE);
    }

    @Test
    void testNullabilityAnnotationsBecomeTypeNullability() {
        Codebase codebase = parse("""
                // Signature format: 2.0
                package test.pkg {
                  public class Foo {
                    method @Nullable public java.lang.String find(@NonNull java.lang.String, java.lang.String);
                  }
                }
                """);

        MemberItem find = codebase.findClass("test.pkg.Foo").getMembers().get(0);
        assertThat(find.getType().getNullability()).isEqualTo(Nullability.NULLABLE);
        assertThat(find.getModifiers().getAnnotations()).isEmpty();
        assertThat(find.getParameters()).extracting(p -> p.getType().getNullability())
                .containsExactly(Nullability.NONNULL, Nullability.PLATFORM);
    }

    @Test
    void testLegacyTypesHaveUndefinedNullability() {
        Codebase codebase = parse("""
                package test.pkg {
                  public class Foo {
                    method public java.lang.String name();
                  }
                }
                """);

        MemberItem name = codebase.findClass("test.pkg.Foo").getMembers().get(0);
        assertThat(name.getType().getNullability()).isEqualTo(Nullability.UNDEFINED);
    }

    @Test
    void testKotlinStyleParameters() {
        Codebase codebase = parse("""
                // Signature format: 5.0
                // - kotlin-name-type-order=yes
                package test.pkg {
                  public final class Foo {
                    method public show(text: java.lang.String?, optional count: int = 3, _: int): void;
                    property public size: int;
                  }
                }
                """);

        ClassItem foo = codebase.findClass("test.pkg.Foo");
        MemberItem show = foo.findMember("method show(java.lang.String,int,int)");
        assertThat(show.getType().isVoid()).isTrue();
        assertThat(show.getParameters()).extracting(ParameterItem::getName).containsExactly("text", "count", null);
        assertThat(show.getParameters().get(0).getType().getNullability()).isEqualTo(Nullability.NULLABLE);
        assertThat(show.getParameters().get(1).isOptional()).isTrue();
        assertThat(show.getParameters().get(1).getDefaultValue()).isEqualTo("3");
        assertThat(foo.findMember("property size").getKind()).isEqualTo(MemberKind.PROPERTY);
    }

    @Test
    void testThrowsAndAnnotationDefault() {
        Codebase codebase = parse("""
                package test.pkg {
                  public class Io {
                    method public void read() throws java.io.IOException, java.lang.InterruptedException;
                  }
                  public @interface Range {
                    method public abstract long[] value() default {1, 2};
                  }
                }
                """);

        MemberItem read = codebase.findClass("test.pkg.Io").getMembers().get(0);
        assertThat(read.getThrownTypes()).extracting(TypeReference::getName)
                .containsExactly("java.io.IOException", "java.lang.InterruptedException");

        MemberItem value = codebase.findClass("test.pkg.Range").getMembers().get(0);
        assertThat(value.getAnnotationDefault()).isEqualTo("{1, 2}");
    }

    @Test
    void testPackageAnnotationsAndRepeatedPackageBlocks() {
        Codebase codebase = parse("""
                package @RestrictTo test.pkg {
                  public class A {
                  }
                }
                package test.pkg {
                  public class B {
                  }
                }
                """);

        assertThat(codebase.getPackages()).hasSize(1);
        assertThat(codebase.findPackage("test.pkg").getModifiers().hasAnnotation("RestrictTo")).isTrue();
        assertThat(codebase.findPackage("test.pkg").getClasses()).hasSize(2);
    }

    @Test
    void testIdenticalDuplicateMemberIsAccepted() {
        Codebase codebase = parse("""
                package test.pkg {
                  public class Foo {
                    method public void m();
                    method public void m();
                  }
                }
                """);

        assertThat(codebase.findClass("test.pkg.Foo").getMembers()).hasSize(1);
    }

    @Test
    void testConflictingDuplicateMemberIsRejected() {
        assertThatThrownBy(() -> parse("""
                package test.pkg {
                  public class Foo {
                    method public void m();
                    method public int m();
                  }
                }
                """))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("api.txt:4")
                .hasMessageContaining("conflicting declaration");
    }

    @Test
    void testConflictingDuplicateClassIsRejected() {
        assertThatThrownBy(() -> parse("""
                package test.pkg {
                  public class Foo {
                  }
                  public final class Foo {
                  }
                }
                """))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("duplicate class test.pkg.Foo");
    }

    @Test
    void testMissingSemicolon() {
        assertThatThrownBy(() -> parse("""
                package test.pkg {
                  public class Foo {
                    method public void m()
                  }
                }
                """))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException pe = (ParseException) e;
                    assertThat(pe.getLine()).isEqualTo(4);
                    assertThat(pe.getReason()).isEqualTo("expected ';', found '}'");
                });
    }

    @Test
    void testUnknownMemberKind() {
        assertThatThrownBy(() -> parse("""
                package test.pkg {
                  public class Foo {
                    function public void m();
                  }
                }
                """))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("expected one of ctor, method, field, property or enum_constant");
    }

    @Test
    void testConflictingModifiers() {
        assertThatThrownBy(() -> parse("""
                package test.pkg {
                  public abstract final class Foo {
                  }
                }
                """))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("conflicting modifiers");

        assertThatThrownBy(() -> parse("""
                package test.pkg {
                  public public class Foo {
                  }
                }
                """))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("duplicate visibility modifier");
    }

    @Test
    void testUnclosedPackage() {
        assertThatThrownBy(() -> parse("package test.pkg {\n  public class Foo {\n  }\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("package test.pkg is not closed");
    }

    @Test
    void testInvalidConstantValue() {
        assertThatThrownBy(() -> parse("""
                package test.pkg {
                  public class Foo {
                    field public static final int X = abc;
                  }
                }
                """))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("api.txt:3")
                .hasMessageContaining("invalid constant value");
    }

    @Test
    void testImplementationModifiersAreDropped() {
        Codebase codebase = parse("""
                package test.pkg {
                  public class Foo {
                    method public synchronized native void m();
                  }
                }
                """);

        assertThat(codebase.findClass("test.pkg.Foo").getMembers().get(0).getModifiers().getFlags()).isEmpty();
    }
}
