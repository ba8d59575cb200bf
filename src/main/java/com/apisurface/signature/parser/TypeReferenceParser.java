package com.apisurface.signature.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.model.AnnotationItem;
import com.apisurface.signature.model.Nullability;
import com.apisurface.signature.model.TypeParameterItem;
import com.apisurface.signature.model.TypeReference;
import com.apisurface.signature.model.TypeReference.WildcardBound;

/**
 * Parses type text such as {@code java.util.Map<K,java.util.List<? extends V>!>?} into
 * {@link TypeReference}s.
 *
 * Names found in the type variable scope become type variables; every other
 * non-primitive name is a class reference, whether or not the class is known.
 * An undotted class name longer than one letter refers to {@code java.lang}, so
 * {@code String} and {@code java.lang.String} parse to the same reference.
 * Errors are reported as {@link IllegalArgumentException}; callers attach a location.
 */
public class TypeReferenceParser {

    private static final String JAVA_LANG_PREFIX = "java.lang.";

    private final FileFormat format;
    private final Set<String> typeVariables;

    private String text;
    private int pos;

    public TypeReferenceParser(FileFormat format, Set<String> typeVariables) {
        this.format = format;
        this.typeVariables = typeVariables;
    }

    public TypeReference parse(String typeText) {
        this.text = typeText;
        this.pos = 0;
        TypeReference type = parseType();
        skipSpaces();
        if (pos < text.length()) {
            throw new IllegalArgumentException("unexpected '" + text.substring(pos) + "' in type " + typeText);
        }
        return type;
    }

    /**
     * Parses a type parameter list including its angle brackets. Names declared in
     * the list are in scope in every bound, together with the parser's own scope.
     */
    public static List<TypeParameterItem> parseTypeParameters(String listText, FileFormat format,
            Set<String> outerScope) {
        String inner = listText.trim();
        if (!inner.startsWith("<") || !inner.endsWith(">")) {
            throw new IllegalArgumentException("invalid type parameter list " + listText);
        }
        List<String> declarations = splitTopLevel(inner.substring(1, inner.length() - 1), ',');
        Set<String> scope = new HashSet<>(outerScope);
        for (String declaration : declarations) {
            scope.add(declarationName(declaration));
        }

        TypeReferenceParser boundParser = new TypeReferenceParser(format, scope);
        List<TypeParameterItem> result = new ArrayList<>();
        for (String declaration : declarations) {
            String name = declarationName(declaration);
            TypeParameterItem.TypeParameterItemBuilder builder = TypeParameterItem.builder().name(name);
            String rest = declaration.trim().substring(name.length()).trim();
            if (!rest.isEmpty()) {
                if (!rest.startsWith("extends ")) {
                    throw new IllegalArgumentException("invalid type parameter " + declaration);
                }
                for (String bound : splitTopLevel(rest.substring("extends ".length()), '&')) {
                    TypeReference boundType = boundParser.parse(bound.trim());
                    if (!boundType.isJavaLangObject()) {
                        builder.bound(boundType);
                    }
                }
            }
            result.add(builder.build());
        }
        return result;
    }

    /**
     * Declared names of a type parameter list, without parsing bounds.
     */
    public static List<String> typeParameterNames(String listText) {
        String inner = listText.trim();
        List<String> names = new ArrayList<>();
        for (String declaration : splitTopLevel(inner.substring(1, inner.length() - 1), ',')) {
            names.add(declarationName(declaration));
        }
        return names;
    }

    /**
     * Parses {@code @name} or {@code @name(args)}. A single unnamed argument is stored
     * under {@code value}.
     */
    public static AnnotationItem parseAnnotation(String annotationText) {
        String trimmed = annotationText.trim();
        if (!trimmed.startsWith("@")) {
            throw new IllegalArgumentException("not an annotation: " + annotationText);
        }
        int paren = trimmed.indexOf('(');
        if (paren < 0) {
            return AnnotationItem.of(trimmed.substring(1));
        }
        if (!trimmed.endsWith(")")) {
            throw new IllegalArgumentException("unterminated annotation " + annotationText);
        }
        AnnotationItem.AnnotationItemBuilder builder = AnnotationItem.builder()
                .qualifiedName(trimmed.substring(1, paren).trim());
        String arguments = trimmed.substring(paren + 1, trimmed.length() - 1).trim();
        if (arguments.isEmpty()) {
            return builder.build();
        }
        for (String argument : splitTopLevel(arguments, ',')) {
            int equals = topLevelIndexOf(argument, '=');
            if (equals < 0) {
                builder.attribute("value", argument.trim());
            } else {
                builder.attribute(argument.substring(0, equals).trim(), argument.substring(equals + 1).trim());
            }
        }
        return builder.build();
    }

    private TypeReference parseType() {
        skipSpaces();
        List<AnnotationItem> annotations = new ArrayList<>();
        while (peek() == '@') {
            annotations.add(parseAnnotation(readAnnotationText()));
            skipSpaces();
        }

        TypeReference type;
        if (peek() == '?') {
            pos++;
            type = parseWildcard();
        } else {
            type = parseNamedType();
        }
        if (!annotations.isEmpty()) {
            type = type.toBuilder().annotations(annotations).build();
        }
        return parseArraySuffixes(type);
    }

    private TypeReference parseWildcard() {
        skipSpaces();
        if (text.startsWith("extends ", pos)) {
            pos += "extends ".length();
            return TypeReference.wildcard(WildcardBound.EXTENDS, parseType());
        }
        if (text.startsWith("super ", pos)) {
            pos += "super ".length();
            return TypeReference.wildcard(WildcardBound.SUPER, parseType());
        }
        return TypeReference.wildcard();
    }

    private TypeReference parseNamedType() {
        String name = readName();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("expected a type name in " + text);
        }
        if (TypeReference.isPrimitiveName(name)) {
            return TypeReference.primitive(name);
        }
        TypeReference.Kind kind = typeVariables.contains(name) ? TypeReference.Kind.VARIABLE : TypeReference.Kind.CLASS;
        if (kind == TypeReference.Kind.CLASS && name.length() > 1 && name.indexOf('.') < 0) {
            name = JAVA_LANG_PREFIX + name;
        }
        TypeReference type = TypeReference.builder()
                .kind(kind)
                .name(name)
                .arguments(parseTypeArguments())
                .build();

        while (peek() == '.' && kind == TypeReference.Kind.CLASS && !type.getArguments().isEmpty()) {
            pos++;
            String inner = readName();
            type = TypeReference.builder()
                    .kind(TypeReference.Kind.CLASS)
                    .name(type.getName() + "." + inner)
                    .outerType(type.withNullability(Nullability.NONNULL))
                    .arguments(parseTypeArguments())
                    .build();
        }
        return type.withNullability(parseNullabilitySuffix());
    }

    private List<TypeReference> parseTypeArguments() {
        List<TypeReference> arguments = new ArrayList<>();
        if (peek() != '<') {
            return arguments;
        }
        pos++;
        while (true) {
            arguments.add(parseType());
            skipSpaces();
            char c = peek();
            pos++;
            if (c == '>') {
                return arguments;
            }
            if (c != ',') {
                throw new IllegalArgumentException("expected ',' or '>' in " + text);
            }
        }
    }

    private TypeReference parseArraySuffixes(TypeReference component) {
        TypeReference type = component;
        while (true) {
            if (text.startsWith("[]", pos)) {
                pos += 2;
                type = TypeReference.arrayOf(type);
            } else if (text.startsWith("...", pos)) {
                pos += 3;
                type = TypeReference.varargsOf(type);
            } else {
                return type;
            }
            type = type.toBuilder().nullability(parseNullabilitySuffix()).build();
        }
    }

    private Nullability parseNullabilitySuffix() {
        char c = peek();
        if (c == '?') {
            pos++;
            return Nullability.NULLABLE;
        }
        if (c == '!') {
            pos++;
            return Nullability.PLATFORM;
        }
        return format.isKotlinStyleNulls() ? Nullability.NONNULL : format.unannotatedNullability();
    }

    private String readName() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '$') {
                pos++;
            } else if (c == '.' && pos + 1 < text.length() && Character.isJavaIdentifierStart(text.charAt(pos + 1))) {
                pos++;
            } else {
                break;
            }
        }
        return text.substring(start, pos);
    }

    private String readAnnotationText() {
        int start = pos;
        pos++;
        readName();
        if (peek() == '(') {
            int depth = 0;
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '(') {
                    depth++;
                } else if (c == ')' && --depth == 0) {
                    break;
                }
            }
        }
        return text.substring(start, pos);
    }

    private void skipSpaces() {
        while (pos < text.length() && text.charAt(pos) == ' ') {
            pos++;
        }
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private static String declarationName(String declaration) {
        String trimmed = declaration.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    /**
     * Splits on a separator that is not nested in brackets, parentheses, braces or quotes.
     */
    static List<String> splitTopLevel(String value, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        char quote = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '<' || c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == '>' || c == ')' || c == '}' || c == ']') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(value.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(value.substring(start));
        return parts;
    }

    private static int topLevelIndexOf(String value, char target) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
