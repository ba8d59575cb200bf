package com.apisurface.signature.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the signature file tokenizer.
 */
@Data
@AllArgsConstructor
public class SignatureToken {
    private TokenType type;
    private String value;
    private int line;

    /**
     * Offsets into the source, end exclusive; used to recover raw expression text.
     */
    private int start;
    private int end;

    public enum TokenType {
        /**
         * Keyword, name, type (with generics kept together) or literal number.
         */
        WORD,
        ANNOTATION,
        STRING_LITERAL,
        CHAR_LITERAL,
        LBRACE,
        RBRACE,
        LPAREN,
        RPAREN,
        COMMA,
        SEMICOLON,
        EQUALS,
        COLON,
        EOF
    }

    public boolean isWord(String word) {
        return type == TokenType.WORD && value.equals(word);
    }
}
