package com.apisurface.signature.format;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ConstantValueRendererTest {

    @Test
    void testNumericLiterals() {
        assertThat(ConstantValueRenderer.literal(42)).isEqualTo("42");
        assertThat(ConstantValueRenderer.literal(42L)).isEqualTo("42L");
        assertThat(ConstantValueRenderer.literal(1.5f)).isEqualTo("1.5f");
        assertThat(ConstantValueRenderer.literal(2.25d)).isEqualTo("2.25");
        assertThat(ConstantValueRenderer.literal(true)).isEqualTo("true");
    }

    @Test
    void testSpecialFloatingPointValues() {
        assertThat(ConstantValueRenderer.literal(Float.NaN)).isEqualTo("(0.0f/0.0f)");
        assertThat(ConstantValueRenderer.literal(Double.NEGATIVE_INFINITY)).isEqualTo("(-1.0/0.0)");
    }

    @Test
    void testCharIsWrittenAsNumberWithComment() {
        assertThat(ConstantValueRenderer.literal('A')).isEqualTo("65");
        assertThat(ConstantValueRenderer.comment('A')).isEqualTo("0x0041 'A'");
    }

    @Test
    void testHexComments() {
        assertThat(ConstantValueRenderer.comment(255)).isEqualTo("0xff");
        assertThat(ConstantValueRenderer.comment(16L)).isEqualTo("0x10L");
        assertThat(ConstantValueRenderer.comment("text")).isNull();
        assertThat(ConstantValueRenderer.comment(1.0d)).isNull();
    }

    @Test
    void testStringEscaping() {
        assertThat(ConstantValueRenderer.literal("a\"b\n\u00e9"))
                .isEqualTo("\"a\\\"b\\n\\u00e9\"");
    }

    @Test
    void testNonConstantIsRejected() {
        assertThatThrownBy(() -> ConstantValueRenderer.literal(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
