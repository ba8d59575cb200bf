package com.apisurface.signature.parser;

import com.apisurface.signature.parser.SignatureToken.TokenType;
import com.apisurface.signature.parser.exception.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SignatureTokenizerTest {

    private static List<SignatureToken> tokenize(String source) {
        return new SignatureTokenizer(source, "api.txt").tokenize();
    }

    @Test
    void testGenericTypeIsOneToken() {
        List<SignatureToken> tokens = tokenize("method public java.util.Map<K, V> get(K key);");

        assertThat(tokens).extracting(SignatureToken::getType).containsExactly(
                TokenType.WORD, TokenType.WORD, TokenType.WORD, TokenType.WORD, TokenType.LPAREN,
                TokenType.WORD, TokenType.WORD, TokenType.RPAREN, TokenType.SEMICOLON, TokenType.EOF);
        assertThat(tokens.get(2).getValue()).isEqualTo("java.util.Map<K, V>");
    }

    @Test
    void testAnnotationWithArgumentsIsOneToken() {
        List<SignatureToken> tokens = tokenize("@IntRange(from=0, to=255) int");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.ANNOTATION);
        assertThat(tokens.get(0).getValue()).isEqualTo("@IntRange(from=0, to=255)");
        assertThat(tokens.get(1).getValue()).isEqualTo("int");
    }

    @Test
    void testAnnotationTypeKeyword() {
        List<SignatureToken> tokens = tokenize("public @interface Marker {");

        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.WORD);
        assertThat(tokens.get(1).getValue()).isEqualTo("@interface");
    }

    @Test
    void testCommentsSkippedAndLinesCounted() {
        List<SignatureToken> tokens = tokenize("// Signature format: 2.0\npackage a {\n  field public int X = 1; // 0x1\n}\n");

        assertThat(tokens.get(0).isWord("package")).isTrue();
        assertThat(tokens.get(0).getLine()).isEqualTo(2);
        assertThat(tokens).extracting(SignatureToken::getValue).doesNotContain("0x1");
        assertThat(tokens.get(tokens.size() - 2).getType()).isEqualTo(TokenType.RBRACE);
        assertThat(tokens.get(tokens.size() - 2).getLine()).isEqualTo(4);
    }

    @Test
    void testStringLiteral() {
        List<SignatureToken> tokens = tokenize("= \"a;b\\\"c\";");

        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.STRING_LITERAL);
        assertThat(tokens.get(1).getValue()).isEqualTo("\"a;b\\\"c\"");
    }

    @Test
    void testUnterminatedStringLiteral() {
        assertThatThrownBy(() -> tokenize("field public java.lang.String S = \"abc;\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unterminated literal");
    }

    @Test
    void testUnbalancedTypeArguments() {
        assertThatThrownBy(() -> tokenize("method public java.util.List<T get();\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unterminated type argument list");
    }
}
