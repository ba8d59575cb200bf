package com.apisurface.signature.parser;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.format.OverloadedMethodOrder;
import com.apisurface.signature.parser.exception.ParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FileFormatHeaderParserTest {

    @Test
    void testVersionHeader() {
        FileFormat format = FileFormatHeaderParser.parseHeader("// Signature format: 3.0\npackage a {\n}\n", "api.txt");

        assertThat(format).isEqualTo(FormatVersion.V3.defaults());
    }

    @Test
    void testNoHeaderReturnsNull() {
        assertThat(FileFormatHeaderParser.parseHeader("package a {\n}\n", "api.txt")).isNull();
        assertThat(FileFormatHeaderParser.parseHeader("", "api.txt")).isNull();
    }

    @Test
    void testPropertyLinesForVersion5() {
        FileFormat format = FileFormatHeaderParser.parseHeader("""
                // Signature format: 5.0
                // - kotlin-name-type-order=yes
                // - overloaded-method-order=source
                package a {
                }
                """, "api.txt");

        assertThat(format.getVersion()).isEqualTo(FormatVersion.V5);
        assertThat(format.isKotlinNameTypeOrder()).isTrue();
        assertThat(format.getOverloadedMethodOrder()).isEqualTo(OverloadedMethodOrder.SOURCE);
    }

    @Test
    void testMigratingSpecifier() {
        FileFormat format = FileFormatHeaderParser.parseHeader(
                "// Signature format: 2.0:kotlin-style-nulls=yes,migrating=test\n", "api.txt");

        assertThat(format.isKotlinStyleNulls()).isTrue();
        assertThat(format.getMigrating()).isEqualTo("test");
    }

    @Test
    void testUnknownVersion() {
        assertThatThrownBy(() -> FileFormatHeaderParser.parseHeader("// Signature format: 9.0\n", "api.txt"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("api.txt:1")
                .hasMessageContaining("invalid version, found '9.0'");
    }

    @Test
    void testCustomizationWithoutMigratingIsRejected() {
        assertThatThrownBy(() -> FileFormatHeaderParser.parseHeader(
                "// Signature format: 2.0:kotlin-style-nulls=yes\n", "api.txt"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("must provide a 'migrating' property");
    }

    @Test
    void testVersion5RejectsInlineProperties() {
        assertThatThrownBy(() -> FileFormatHeaderParser.parseSpecifier("5.0:kotlin-style-nulls=no", "api.txt", 1))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("does not support properties on the version line");
    }

    @Test
    void testMalformedPropertyLine() {
        assertThatThrownBy(() -> FileFormatHeaderParser.parseHeader(
                "// Signature format: 5.0\n// - kotlin-style-nulls\n", "api.txt"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getLine()).isEqualTo(2));
    }
}
