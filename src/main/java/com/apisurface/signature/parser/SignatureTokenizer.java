package com.apisurface.signature.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.parser.SignatureToken.TokenType;
import com.apisurface.signature.parser.exception.ParseException;

/**
 * Tokenizer for signature files.
 *
 * Generic argument lists, annotation argument lists and literals are kept inside a
 * single token, so {@code java.util.Map<K, V>} and {@code @IntRange(from=0, to=255)} each
 * come out as one token. Line comments are skipped, including the format header.
 */
public class SignatureTokenizer {
    private static final Logger log = LoggerFactory.getLogger(SignatureTokenizer.class);

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;

    public SignatureTokenizer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source file.
     */
    public List<SignatureToken> tokenize() {
        List<SignatureToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new SignatureToken(TokenType.EOF, "", line, pos, pos));
        log.debug("Tokenized {} into {} tokens", fileName, tokens.size());
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && pos + 1 < source.length() && source.charAt(pos + 1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private SignatureToken nextToken() {
        char c = source.charAt(pos);
        int start = pos;

        switch (c) {
            case '{':
                return single(TokenType.LBRACE);
            case '}':
                return single(TokenType.RBRACE);
            case '(':
                return single(TokenType.LPAREN);
            case ')':
                return single(TokenType.RPAREN);
            case ',':
                return single(TokenType.COMMA);
            case ';':
                return single(TokenType.SEMICOLON);
            case '=':
                return single(TokenType.EQUALS);
            case ':':
                return single(TokenType.COLON);
            case '"':
                skipLiteral('"');
                return token(TokenType.STRING_LITERAL, start);
            case '\'':
                skipLiteral('\'');
                return token(TokenType.CHAR_LITERAL, start);
            case '@':
                return readAnnotation(start);
            default:
                if (isWordChar(c) || c == '<') {
                    readWord();
                    return token(TokenType.WORD, start);
                }
                throw new ParseException("unexpected character '" + c + "'", fileName, line);
        }
    }

    private SignatureToken single(TokenType type) {
        int start = pos;
        pos++;
        return token(type, start);
    }

    private SignatureToken token(TokenType type, int start) {
        return new SignatureToken(type, source.substring(start, pos), line, start, pos);
    }

    private SignatureToken readAnnotation(int start) {
        pos++;
        while (pos < source.length() && isNameChar(source.charAt(pos))) {
            pos++;
        }
        String name = source.substring(start, pos);
        if (name.equals("@interface")) {
            return token(TokenType.WORD, start);
        }
        if (name.length() == 1) {
            throw new ParseException("expected annotation name after '@'", fileName, line);
        }
        if (pos < source.length() && source.charAt(pos) == '(') {
            skipBalanced('(', ')');
        }
        return token(TokenType.ANNOTATION, start);
    }

    /**
     * Reads a word, keeping everything between matching angle brackets (spaces included).
     */
    private void readWord() {
        int depth = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                if (depth == 0) {
                    throw new ParseException("unbalanced '>'", fileName, line);
                }
                depth--;
            } else if (c == '\n') {
                if (depth > 0) {
                    throw new ParseException("unterminated type argument list", fileName, line);
                }
                return;
            } else if (depth == 0 && !isWordChar(c)) {
                return;
            } else if (depth > 0 && (c == '"' || c == '\'')) {
                skipLiteral(c);
                continue;
            }
            pos++;
        }
        if (depth > 0) {
            throw new ParseException("unterminated type argument list", fileName, line);
        }
    }

    private void skipBalanced(char open, char close) {
        int depth = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"' || c == '\'') {
                skipLiteral(c);
                continue;
            }
            if (c == '\n') {
                break;
            }
            pos++;
            if (c == open) {
                depth++;
            } else if (c == close && --depth == 0) {
                return;
            }
        }
        throw new ParseException("unterminated '" + open + "'", fileName, line);
    }

    private void skipLiteral(char quote) {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '\n') {
                break;
            }
            pos++;
            if (c == quote) {
                return;
            }
        }
        throw new ParseException("unterminated literal", fileName, line);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
    }

    private static boolean isWordChar(char c) {
        return isNameChar(c) || "[]?!-+/*&|~%^".indexOf(c) >= 0;
    }
}
