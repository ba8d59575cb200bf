package com.apisurface.signature.merge;

import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.parser.SignatureParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CodebaseSubtractorTest {

    private final CodebaseSubtractor subtractor = new CodebaseSubtractor();

    private static Codebase parse(String body) {
        return SignatureParser.parse("api.txt", "// Signature format: 2.0\n" + body);
    }

    @Test
    void testMembersRemovedBySignature() {
        Codebase full = parse("""
                package test.pkg {
                  public class Foo {
                    ctor public Foo();
                    method public void m(int);
                    method public void m(java.lang.String);
                  }
                }
                """);
        Codebase part = parse("""
                package test.pkg {
                  public class Foo {
                    method public deprecated int m(int);
                  }
                }
                """);

        Codebase remaining = subtractor.subtract(full, part);

        assertThat(remaining.findClass("test.pkg.Foo").getMembers()).extracting(MemberItem::signatureKey)
                .containsExactly("ctor Foo()", "method m(java.lang.String)");
    }

    @Test
    void testFullySubtractedClassesAndPackagesDisappear() {
        Codebase full = parse("""
                package a.pkg {
                  public class A {
                    method public void m();
                  }
                }
                package b.pkg {
                  public class B {
                    method public void m();
                  }
                  public class Untouched {
                  }
                }
                """);
        Codebase part = parse("""
                package a.pkg {
                  public class A {
                    method public void m();
                  }
                }
                package b.pkg {
                  public class B {
                    method public void m();
                  }
                }
                """);

        Codebase remaining = subtractor.subtract(full, part);

        assertThat(remaining.findPackage("a.pkg")).isNull();
        assertThat(remaining.findClass("test.pkg.B")).isNull();
        assertThat(remaining.findClass("b.pkg.B")).isNull();
        assertThat(remaining.findClass("b.pkg.Untouched")).isNotNull();
        assertThat(remaining.getFormat()).isEqualTo(full.getFormat());
    }

    @Test
    void testNestedClassesSubtractedIndependently() {
        Codebase full = parse("""
                package test.pkg {
                  public class Outer {
                    method public void keep();
                  }
                  public static class Outer.Inner {
                    method public void drop();
                  }
                }
                """);
        Codebase part = parse("""
                package test.pkg {
                  public static class Outer.Inner {
                    method public void drop();
                  }
                }
                """);

        Codebase remaining = subtractor.subtract(full, part);

        assertThat(remaining.findClass("test.pkg.Outer").getNestedClasses()).isEmpty();
        assertThat(remaining.findClass("test.pkg.Outer").getMembers()).hasSize(1);
    }
}
