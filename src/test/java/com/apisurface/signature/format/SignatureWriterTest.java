package com.apisurface.signature.format;

import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.parser.SignatureParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SignatureWriter, driven through the parser.
 */
class SignatureWriterTest {

    private static String reformat(String text) {
        return SignatureWriter.write(SignatureParser.parse("api.txt", text));
    }

    @Test
    void testMethodLineIsStableUnderSameFormat() {
        String text = """
                // Signature format: 2.0
                package test.pkg {

                  public class Foo {
                    ctor public Foo();
                    method public void foo(int);
                  }

                }

                """;

        assertThat(reformat(text)).isEqualTo(text);
    }

    @Test
    void testCanonicalFileIsIdempotent() {
        String text = """
                // Signature format: 2.0
                package test.pkg {

                  public abstract class Base<T extends java.lang.Number> implements java.io.Serializable {
                    ctor protected Base();
                    method public abstract T get();
                    method @Nullable public java.lang.String name(@NonNull java.lang.String);
                    method public static <E> java.util.List<E> of(E...);
                    field public static final int COUNT = 3; // 0x3
                    field public static final java.lang.String NAME = "base";
                  }

                  public interface Listener {
                    method public void onEvent(java.lang.Object) throws java.io.IOException;
                    method public default void reset();
                  }

                  public static class Listener.Adapter implements test.pkg.Listener {
                    ctor public Listener.Adapter();
                  }

                }

                """;

        String once = reformat(text);
        assertThat(once).isEqualTo(text);
        assertThat(reformat(once)).isEqualTo(once);
    }

    @Test
    void testPackagesClassesAndMembersAreSorted() {
        String text = """
                // Signature format: 2.0
                package z.pkg {
                  public class Zed {
                    field public int b;
                    method public void b();
                    method public void a(int, int);
                    method public void a(int);
                    ctor public Zed();
                  }
                }
                package a.pkg {
                  public class Beta {
                  }
                  public class Alpha {
                  }
                }
                """;

        assertThat(reformat(text)).isEqualTo("""
                // Signature format: 2.0
                package a.pkg {

                  public class Alpha {
                  }

                  public class Beta {
                  }

                }

                package z.pkg {

                  public class Zed {
                    ctor public Zed();
                    method public void a(int);
                    method public void a(int, int);
                    method public void b();
                    field public int b;
                  }

                }

                """);
    }

    @Test
    void testInterfaceKeepsFirstSuperInterfaceInFront() {
        String text = """
                // Signature format: 2.0
                package test.pkg {
                  public interface Multi extends test.pkg.Zeta test.pkg.Alpha test.pkg.Beta {
                  }
                  public class Impl implements test.pkg.Zeta test.pkg.Alpha {
                  }
                }
                """;

        assertThat(reformat(text))
                .contains("public interface Multi extends test.pkg.Zeta test.pkg.Alpha test.pkg.Beta {")
                .contains("public class Impl implements test.pkg.Alpha test.pkg.Zeta {");
    }

    @Test
    void testKotlinStyleNullsSuffixes() {
        String text = """
                // Signature format: 3.0
                package test.pkg {

                  public final class Foo {
                    ctor public Foo();
                    method public String? find(String, java.util.List<java.lang.String!>);
                  }

                }

                """;

        assertThat(reformat(text)).isEqualTo(text);
    }

    @Test
    void testMigrateJavaNullabilityAnnotationsToKotlinStyle() {
        Codebase codebase = SignatureParser.parse("api.txt", """
                // Signature format: 2.0
                package test.pkg {
                  public class Foo {
                    method @Nullable public java.lang.String find(@NonNull java.lang.String, java.lang.String);
                  }
                }
                """);

        String migrated = SignatureWriter.write(codebase.toBuilder().format(FormatVersion.V3.defaults()).build());

        assertThat(migrated)
                .startsWith("// Signature format: 3.0\n")
                .contains("method public String? find(String, String!);");
    }

    @Test
    void testKotlinNameTypeOrder() {
        String text = """
                // Signature format: 5.0
                // - kotlin-name-type-order=yes
                package test.pkg {

                  public final class Foo {
                    method public find(key: String?, optional limit: int): String;
                    property public count: int;
                  }

                }

                """;

        assertThat(reformat(text)).isEqualTo(text);
    }

    @Test
    void testDefaultValuesOnlyWrittenWhenNotConcise() {
        String text = """
                // Signature format: 3.0
                package test.pkg {

                  public final class Foo {
                    method public void show(optional int count = 1);
                  }

                }

                """;

        Codebase codebase = SignatureParser.parse("api.txt", text);

        assertThat(SignatureWriter.write(codebase)).isEqualTo(text);
        assertThat(SignatureWriter.write(codebase.toBuilder().format(FormatVersion.V4.defaults()).build()))
                .contains("method public void show(optional int count);");
    }

    @Test
    void testLegacyFileRoundTripsWithoutHeader() {
        String text = """
                package test.pkg {

                  public class Foo {
                    method public java.lang.String name();
                  }

                }

                """;

        Codebase codebase = SignatureParser.parse("api.txt", text);

        assertThat(codebase.getFormat().getVersion()).isEqualTo(FormatVersion.V1);
        assertThat(SignatureWriter.write(codebase)).isEqualTo(text);
    }

    @Test
    void testAnnotationDefaultAndEnumConstants() {
        String text = """
                // Signature format: 2.0
                package test.pkg {

                  public enum Color {
                    enum_constant public static final test.pkg.Color RED;
                  }

                  public @interface Marker {
                    method public abstract int level() default 1;
                  }

                }

                """;

        assertThat(reformat(text)).isEqualTo(text);
    }

    @Test
    void testAnnotationMethodsKeepAbstract() {
        String text = """
                // Signature format: 3.0
                package test.pkg {

                  public @interface Range {
                    method public abstract int from() default java.lang.Integer.MIN_VALUE;
                    method public abstract int to() default java.lang.Integer.MAX_VALUE;
                  }

                  public interface Source {
                    method public int next();
                  }

                }

                """;

        assertThat(reformat(text)).isEqualTo(text);
    }

    @Test
    void testJavaLangPrefixOnlyDroppedForTopLevelJavaLangTypes() {
        String text = """
                // Signature format: 3.0
                package test.pkg {

                  public class Foo<T extends java.lang.Comparable<T>> extends java.lang.Exception {
                    ctor public Foo();
                    method public Object![] all(String...);
                    method public java.util.List<java.lang.String!>? names() throws java.lang.IllegalStateException;
                    method public java.lang.annotation.RetentionPolicy policy();
                    method public java.lang.Thread.State state();
                  }

                }

                """;

        assertThat(reformat(text)).isEqualTo(text);
    }

    @Test
    void testBareClassNamesAreReadAsJavaLang() {
        Codebase codebase = SignatureParser.parse("api.txt", """
                // Signature format: 3.0
                package test.pkg {
                  public class Foo {
                    method public String name(Object!);
                  }
                }
                """);

        String legacy = SignatureWriter.write(codebase.toBuilder().format(FormatVersion.V2.defaults()).build());

        assertThat(legacy).contains("method public java.lang.String name(java.lang.Object);");
    }
}
