package com.apisurface.signature.format;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FileFormatTest {

    @Test
    void testLegacyFormatHasNoHeader() {
        assertThat(FormatVersion.V1.defaults().header()).isEmpty();
    }

    @Test
    void testVersionHeader() {
        assertThat(FormatVersion.V2.defaults().header()).isEqualTo("// Signature format: 2.0\n");
        assertThat(FormatVersion.V3.defaults().header()).isEqualTo("// Signature format: 3.0\n");
    }

    @Test
    void testVersionDefaults() {
        FileFormat v2 = FormatVersion.V2.defaults();
        FileFormat v4 = FormatVersion.V4.defaults();

        assertThat(v2.isKotlinStyleNulls()).isFalse();
        assertThat(v4.isKotlinStyleNulls()).isTrue();
        assertThat(v4.isConciseDefaultValues()).isTrue();
        assertThat(v4.getOverloadedMethodOrder()).isEqualTo(OverloadedMethodOrder.SIGNATURE);
    }

    @Test
    void testCustomizedOldVersionRequiresMigrating() {
        FileFormat customized = FormatVersion.V2.defaults().withProperty("kotlin-style-nulls", "yes");

        assertThatThrownBy(customized::header)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("migrating");

        FileFormat migrating = customized.withProperty("migrating", "test");
        assertThat(migrating.header())
                .isEqualTo("// Signature format: 2.0:kotlin-style-nulls=yes,migrating=test\n");
    }

    @Test
    void testPropertiesWrittenOnSeparateLinesForVersion5() {
        FileFormat format = FormatVersion.V5.defaults()
                .withProperty("kotlin-name-type-order", "yes")
                .withProperty("include-type-use-annotations", "yes");

        assertThat(format.header()).isEqualTo("""
                // Signature format: 5.0
                // - include-type-use-annotations=yes
                // - kotlin-name-type-order=yes
                """);
    }

    @Test
    void testSpecifierListsOnlyOverridingProperties() {
        FileFormat format = FormatVersion.V3.defaults().withProperty("overloaded-method-order", "source");

        assertThat(format.specifier()).isEqualTo("3.0:overloaded-method-order=source");
        assertThat(FormatVersion.V3.defaults().specifier()).isEqualTo("3.0");
    }

    @Test
    void testUnknownPropertyIsRejected() {
        assertThatThrownBy(() -> FormatVersion.V5.defaults().withProperty("bogus", "yes"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown format property name");
    }

    @Test
    void testInvalidBooleanValueIsRejected() {
        assertThatThrownBy(() -> FormatVersion.V5.defaults().withProperty("kotlin-style-nulls", "maybe"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected one of 'yes' or 'no'");
    }

    @Test
    void testLegacyFormatCannotRecordProperties() {
        FileFormat format = FormatVersion.V1.defaults().withProperty("kotlin-style-nulls", "yes");

        assertThatThrownBy(format::header).isInstanceOf(IllegalStateException.class);
    }
}
