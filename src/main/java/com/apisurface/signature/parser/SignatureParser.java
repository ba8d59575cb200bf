package com.apisurface.signature.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.format.FormatVersion;
import com.apisurface.signature.model.AnnotationItem;
import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.ClassKind;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.MemberKind;
import com.apisurface.signature.model.Modifier;
import com.apisurface.signature.model.ModifierSet;
import com.apisurface.signature.model.Nullability;
import com.apisurface.signature.model.PackageItem;
import com.apisurface.signature.model.ParameterItem;
import com.apisurface.signature.model.TypeParameterItem;
import com.apisurface.signature.model.TypeReference;
import com.apisurface.signature.model.Visibility;
import com.apisurface.signature.parser.SignatureToken.TokenType;
import com.apisurface.signature.parser.exception.ParseException;

/**
 * Parser for signature files.
 * Converts tokens into an immutable {@link Codebase}.
 *
 * A file without a format header is read with the legacy format. Any error aborts the
 * parse with a {@link ParseException} carrying the file name and line.
 *
 * Within one file, a class or member declared twice must be declared identically;
 * combining different declarations of the same class is the job of the merger.
 */
public class SignatureParser {
    private static final Logger log = LoggerFactory.getLogger(SignatureParser.class);

    private static final Set<Modifier> DROPPED_MODIFIERS =
            Set.of(Modifier.SYNCHRONIZED, Modifier.NATIVE, Modifier.STRICTFP);

    private final String source;
    private final String fileName;
    private final FileFormat headerlessFormat;

    private FileFormat format;
    private List<SignatureToken> tokens;
    private int pos = 0;

    private final Map<String, PackageDraft> packages = new LinkedHashMap<>();

    public SignatureParser(String source, String fileName) {
        this(source, fileName, FormatVersion.V1.defaults());
    }

    /**
     * @param headerlessFormat format assumed when the text has no header
     */
    public SignatureParser(String source, String fileName, FileFormat headerlessFormat) {
        this.source = source;
        this.fileName = fileName;
        this.headerlessFormat = headerlessFormat;
    }

    public static Codebase parse(String fileName, String source) {
        return new SignatureParser(source, fileName).parse();
    }

    public Codebase parse() {
        FileFormat declared = FileFormatHeaderParser.parseHeader(source, fileName);
        format = declared != null ? declared : headerlessFormat;
        tokens = new SignatureTokenizer(source, fileName).tokenize();

        while (!isAtEnd()) {
            parsePackage();
        }

        Codebase codebase = build();
        log.debug("Parsed {} (format {}): {} package(s)", fileName, format.specifier(), codebase.getPackages().size());
        return codebase;
    }

    // ------------------------------------------------------------------
    // Packages and classes
    // ------------------------------------------------------------------

    private void parsePackage() {
        expectWord("package");
        List<AnnotationItem> annotations = new ArrayList<>();
        while (check(TokenType.ANNOTATION)) {
            annotations.add(annotation(advance()));
        }
        String name = expect(TokenType.WORD).getValue();
        expect(TokenType.LBRACE);

        PackageDraft pkg = packages.computeIfAbsent(name, PackageDraft::new);
        for (AnnotationItem annotation : annotations) {
            if (!pkg.annotations.contains(annotation)) {
                pkg.annotations.add(annotation);
            }
        }

        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error("unexpected end of file, package " + name + " is not closed");
            }
            parseClass(pkg);
        }
        expect(TokenType.RBRACE);
    }

    private void parseClass(PackageDraft pkg) {
        int line = peek().getLine();
        ParsedModifiers modifiers = parseModifiers();

        SignatureToken kindToken = expect(TokenType.WORD);
        ClassKind kind = ClassKind.fromKeyword(kindToken.getValue());
        if (kind == null) {
            throw error("expected one of class, interface, @interface, enum or record, found '"
                    + kindToken.getValue() + "'", kindToken);
        }

        SignatureToken nameToken = expect(TokenType.WORD);
        String nameText = nameToken.getValue();
        int generics = nameText.indexOf('<');
        String fullName = generics < 0 ? nameText : nameText.substring(0, generics);

        Set<String> scope = new HashSet<>(outerTypeVariables(pkg, fullName));
        List<TypeParameterItem> typeParameters = List.of();
        if (generics >= 0) {
            String list = nameText.substring(generics);
            scope.addAll(TypeReferenceParser.typeParameterNames(list));
            typeParameters = typeParameters(list, scope, nameToken);
        }

        TypeReference superclass = null;
        List<TypeReference> interfaces = new ArrayList<>();
        if (checkWord("extends")) {
            advance();
            if (kind.isInterfaceLike()) {
                readTypeList(interfaces, scope);
            } else {
                superclass = type(expect(TokenType.WORD), scope);
            }
        }
        if (checkWord("implements")) {
            advance();
            readTypeList(interfaces, scope);
        }
        expect(TokenType.LBRACE);

        ClassItem header = ClassItem.builder()
                .packageName(pkg.name)
                .fullName(fullName)
                .kind(kind)
                .modifiers(impliedClassModifiers(kind, fullName, modifiers.build()))
                .typeParameters(typeParameters)
                .superclass(normalizeSuperclass(kind, superclass))
                .interfaces(kind == ClassKind.ANNOTATION ? List.of() : interfaces)
                .build();

        ClassDraft draft = pkg.classes.get(fullName);
        if (draft == null) {
            draft = new ClassDraft(header, scope);
            pkg.classes.put(fullName, draft);
        } else if (!draft.header.equals(header)) {
            throw new ParseException("duplicate class " + header.qualifiedName()
                    + " with a conflicting declaration (first declared at line " + draft.line + ")", fileName, line);
        }
        draft.line = draft.line == 0 ? line : draft.line;

        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error("unexpected end of file, class " + header.qualifiedName() + " is not closed");
            }
            parseMember(draft);
        }
        expect(TokenType.RBRACE);
    }

    private void readTypeList(List<TypeReference> target, Set<String> scope) {
        while (check(TokenType.WORD) && !checkWord("implements")) {
            target.add(type(advance(), scope));
            if (check(TokenType.COMMA)) {
                advance();
            }
        }
    }

    private Set<String> outerTypeVariables(PackageDraft pkg, String fullName) {
        Set<String> scope = new HashSet<>();
        int dot = fullName.lastIndexOf('.');
        if (dot > 0) {
            ClassDraft outer = pkg.classes.get(fullName.substring(0, dot));
            if (outer != null) {
                scope.addAll(outer.scope);
            }
        }
        return scope;
    }

    private static ModifierSet impliedClassModifiers(ClassKind kind, String fullName, ModifierSet modifiers) {
        if (kind.isInterfaceLike()) {
            return modifiers.with(Modifier.ABSTRACT);
        }
        if (kind == ClassKind.ENUM) {
            ModifierSet result = modifiers.with(Modifier.FINAL);
            return fullName.indexOf('.') >= 0 ? result.with(Modifier.STATIC) : result.without(Modifier.STATIC);
        }
        return modifiers;
    }

    private static TypeReference normalizeSuperclass(ClassKind kind, TypeReference superclass) {
        if (superclass == null || superclass.isJavaLangObject() || kind != ClassKind.CLASS) {
            return null;
        }
        return superclass;
    }

    // ------------------------------------------------------------------
    // Members
    // ------------------------------------------------------------------

    private void parseMember(ClassDraft cls) {
        int line = peek().getLine();
        SignatureToken kindToken = expect(TokenType.WORD);
        MemberKind kind = MemberKind.fromKeyword(kindToken.getValue());
        if (kind == null) {
            throw error("expected one of ctor, method, field, property or enum_constant, found '"
                    + kindToken.getValue() + "'", kindToken);
        }
        ParsedModifiers modifiers = parseModifiers();
        MemberItem member = kind.isCallable()
                ? parseCallable(kind, modifiers, cls)
                : parseVariable(kind, modifiers, cls);
        expect(TokenType.SEMICOLON);

        String key = member.signatureKey();
        MemberItem existing = cls.members.get(key);
        if (existing == null) {
            cls.members.put(key, member);
        } else if (!existing.equals(member)) {
            throw new ParseException("duplicate " + member.describe(cls.header) + " with a conflicting declaration",
                    fileName, line);
        }
    }

    private MemberItem parseCallable(MemberKind kind, ParsedModifiers modifiers, ClassDraft cls) {
        Set<String> scope = new HashSet<>(cls.scope);
        List<TypeParameterItem> typeParameters = List.of();
        if (check(TokenType.WORD) && peek().getValue().startsWith("<")) {
            SignatureToken listToken = advance();
            scope.addAll(TypeReferenceParser.typeParameterNames(listToken.getValue()));
            typeParameters = typeParameters(listToken.getValue(), scope, listToken);
        }

        TypeReference returnType = null;
        String name;
        boolean kotlinOrder = kind == MemberKind.METHOD && check(TokenType.WORD) && checkNext(TokenType.LPAREN);
        if (kind == MemberKind.METHOD && !kotlinOrder) {
            returnType = type(expect(TokenType.WORD), scope);
        }
        name = expect(TokenType.WORD).getValue();
        List<ParameterItem> parameters = parseParameters(scope);
        if (kotlinOrder) {
            expect(TokenType.COLON);
            returnType = type(expect(TokenType.WORD), scope);
        }

        List<TypeReference> thrownTypes = new ArrayList<>();
        if (checkWord("throws")) {
            advance();
            thrownTypes.add(type(expect(TokenType.WORD), scope));
            while (check(TokenType.COMMA)) {
                advance();
                thrownTypes.add(type(expect(TokenType.WORD), scope));
            }
        }

        String annotationDefault = null;
        if (checkWord("default")) {
            advance();
            annotationDefault = rawUntil(TokenType.SEMICOLON);
        }

        ModifierSet memberModifiers = modifiers.build();
        if (kind == MemberKind.METHOD && cls.header.getKind().isInterfaceLike()
                && !memberModifiers.has(Modifier.DEFAULT) && !memberModifiers.isStatic()) {
            memberModifiers = memberModifiers.with(Modifier.ABSTRACT);
        }

        return MemberItem.builder()
                .kind(kind)
                .name(name)
                .modifiers(memberModifiers)
                .type(returnType == null ? null : modifiers.applyNullability(returnType))
                .typeParameters(typeParameters)
                .parameters(parameters)
                .thrownTypes(thrownTypes)
                .annotationDefault(annotationDefault)
                .build();
    }

    private MemberItem parseVariable(MemberKind kind, ParsedModifiers modifiers, ClassDraft cls) {
        TypeReference type;
        String name;
        if (check(TokenType.WORD) && checkNext(TokenType.COLON)) {
            name = advance().getValue();
            advance();
            type = type(expect(TokenType.WORD), cls.scope);
        } else {
            type = type(expect(TokenType.WORD), cls.scope);
            name = expect(TokenType.WORD).getValue();
        }

        Object constantValue = null;
        if (check(TokenType.EQUALS)) {
            SignatureToken equals = advance();
            if (kind != MemberKind.FIELD) {
                throw error("only fields may declare a value", equals);
            }
            String literal = rawUntil(TokenType.SEMICOLON);
            try {
                constantValue = ConstantValueParser.parse(literal, type);
            } catch (IllegalArgumentException e) {
                throw new ParseException(e.getMessage(), fileName, equals.getLine(), e);
            }
        }

        return MemberItem.builder()
                .kind(kind)
                .name(name)
                .modifiers(modifiers.build())
                .type(modifiers.applyNullability(type))
                .constantValue(constantValue)
                .build();
    }

    private List<ParameterItem> parseParameters(Set<String> scope) {
        expect(TokenType.LPAREN);
        List<ParameterItem> parameters = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            boolean optional = false;
            if (checkWord("optional") && !checkNext(TokenType.COLON)) {
                advance();
                optional = true;
            }
            ParsedModifiers modifiers = parseModifiers();

            String name = null;
            TypeReference type;
            if (check(TokenType.WORD) && checkNext(TokenType.COLON)) {
                String written = advance().getValue();
                name = "_".equals(written) ? null : written;
                advance();
                type = type(expect(TokenType.WORD), scope);
            } else {
                type = type(expect(TokenType.WORD), scope);
                if (check(TokenType.WORD)) {
                    name = advance().getValue();
                }
            }

            String defaultValue = null;
            if (check(TokenType.EQUALS)) {
                advance();
                defaultValue = rawUntil(TokenType.COMMA, TokenType.RPAREN);
                optional = true;
            }

            parameters.add(ParameterItem.builder()
                    .name(name)
                    .type(modifiers.applyNullability(type))
                    .modifiers(modifiers.build())
                    .optional(optional)
                    .defaultValue(defaultValue)
                    .build());

            if (!check(TokenType.RPAREN)) {
                expect(TokenType.COMMA);
            }
        }
        expect(TokenType.RPAREN);
        return parameters;
    }

    // ------------------------------------------------------------------
    // Modifiers, types, raw values
    // ------------------------------------------------------------------

    private ParsedModifiers parseModifiers() {
        ParsedModifiers parsed = new ParsedModifiers();
        boolean visibilitySeen = false;
        while (true) {
            if (check(TokenType.ANNOTATION)) {
                AnnotationItem annotation = annotation(advance());
                Nullability nullability = format.isKotlinStyleNulls()
                        ? null
                        : Nullability.fromAnnotation(annotation.getQualifiedName());
                if (nullability != null) {
                    parsed.nullability = nullability;
                } else {
                    parsed.builder.annotation(annotation);
                }
                continue;
            }
            if (!check(TokenType.WORD) || checkNext(TokenType.COLON) || checkNext(TokenType.LPAREN)) {
                break;
            }
            String word = peek().getValue();
            Visibility visibility = Visibility.fromKeyword(word);
            if (visibility != null) {
                if (visibilitySeen) {
                    throw error("duplicate visibility modifier '" + word + "'");
                }
                visibilitySeen = true;
                parsed.builder.visibility(visibility);
                advance();
                continue;
            }
            Modifier modifier = Modifier.fromKeyword(word);
            if (modifier == null) {
                break;
            }
            if (parsed.flags.contains(modifier)) {
                throw error("duplicate modifier '" + word + "'");
            }
            parsed.flags.add(modifier);
            if (!DROPPED_MODIFIERS.contains(modifier)) {
                parsed.builder.flag(modifier);
            }
            advance();
        }
        if (parsed.flags.contains(Modifier.ABSTRACT) && parsed.flags.contains(Modifier.FINAL)) {
            throw error("conflicting modifiers 'abstract' and 'final'");
        }
        return parsed;
    }

    private AnnotationItem annotation(SignatureToken token) {
        try {
            return TypeReferenceParser.parseAnnotation(token.getValue());
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), fileName, token.getLine(), e);
        }
    }

    private TypeReference type(SignatureToken token, Set<String> scope) {
        try {
            return new TypeReferenceParser(format, scope).parse(token.getValue());
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), fileName, token.getLine(), e);
        }
    }

    private List<TypeParameterItem> typeParameters(String list, Set<String> scope, SignatureToken token) {
        try {
            return TypeReferenceParser.parseTypeParameters(list, format, scope);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), fileName, token.getLine(), e);
        }
    }

    /**
     * Source text of the tokens up to, not including, the first stop token outside
     * parentheses and braces.
     */
    private String rawUntil(TokenType... stops) {
        int start = peek().getStart();
        int end = start;
        int depth = 0;
        while (!isAtEnd()) {
            TokenType type = peek().getType();
            if (depth == 0 && List.of(stops).contains(type)) {
                break;
            }
            if (type == TokenType.LPAREN || type == TokenType.LBRACE) {
                depth++;
            } else if (type == TokenType.RPAREN || type == TokenType.RBRACE) {
                depth--;
            }
            end = advance().getEnd();
        }
        if (end == start) {
            throw error("expected a value, found '" + peek().getValue() + "'");
        }
        return source.substring(start, end);
    }

    // ------------------------------------------------------------------
    // Tree assembly
    // ------------------------------------------------------------------

    private Codebase build() {
        Codebase.CodebaseBuilder builder = Codebase.builder().format(format).origin(fileName);
        for (PackageDraft pkg : packages.values()) {
            Map<String, List<ClassDraft>> children = new LinkedHashMap<>();
            List<ClassDraft> topLevel = new ArrayList<>();
            for (ClassDraft draft : pkg.classes.values()) {
                String fullName = draft.header.getFullName();
                int dot = fullName.lastIndexOf('.');
                String outer = dot < 0 ? null : fullName.substring(0, dot);
                if (outer != null && pkg.classes.containsKey(outer)) {
                    children.computeIfAbsent(outer, k -> new ArrayList<>()).add(draft);
                } else {
                    topLevel.add(draft);
                }
            }
            PackageItem.PackageItemBuilder pkgBuilder = PackageItem.builder()
                    .name(pkg.name)
                    .modifiers(ModifierSet.builder().annotations(pkg.annotations).build());
            for (ClassDraft draft : topLevel) {
                pkgBuilder.cls(buildClass(draft, children));
            }
            builder.pkg(pkgBuilder.build());
        }
        return builder.build();
    }

    private ClassItem buildClass(ClassDraft draft, Map<String, List<ClassDraft>> children) {
        ClassItem.ClassItemBuilder builder = draft.header.toBuilder().members(draft.members.values());
        for (ClassDraft child : children.getOrDefault(draft.header.getFullName(), List.of())) {
            builder.nestedClass(buildClass(child, children));
        }
        return builder.build();
    }

    // ------------------------------------------------------------------
    // Token helpers
    // ------------------------------------------------------------------

    private SignatureToken peek() {
        return tokens.get(pos);
    }

    private SignatureToken advance() {
        SignatureToken token = tokens.get(pos);
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private boolean checkNext(TokenType type) {
        return pos + 1 < tokens.size() && tokens.get(pos + 1).getType() == type;
    }

    private boolean checkWord(String word) {
        return peek().isWord(word);
    }

    private SignatureToken expect(TokenType type) {
        if (!check(type)) {
            throw error("expected " + describe(type) + ", found '" + peek().getValue() + "'");
        }
        return advance();
    }

    private void expectWord(String word) {
        if (!checkWord(word)) {
            throw error("expected '" + word + "', found '" + peek().getValue() + "'");
        }
        advance();
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private ParseException error(String message) {
        return error(message, peek());
    }

    private ParseException error(String message, SignatureToken token) {
        return new ParseException(message, fileName, token.getLine());
    }

    private static String describe(TokenType type) {
        switch (type) {
            case LBRACE:
                return "'{'";
            case RBRACE:
                return "'}'";
            case LPAREN:
                return "'('";
            case RPAREN:
                return "')'";
            case COMMA:
                return "','";
            case SEMICOLON:
                return "';'";
            case COLON:
                return "':'";
            case EQUALS:
                return "'='";
            case WORD:
                return "a name or type";
            default:
                return type.name().toLowerCase();
        }
    }

    // ------------------------------------------------------------------
    // Mutable drafts, only alive during one parse
    // ------------------------------------------------------------------

    private static final class PackageDraft {
        private final String name;
        private final List<AnnotationItem> annotations = new ArrayList<>();
        private final Map<String, ClassDraft> classes = new LinkedHashMap<>();

        private PackageDraft(String name) {
            this.name = name;
        }
    }

    private static final class ClassDraft {
        private final ClassItem header;
        private final Set<String> scope;
        private final Map<String, MemberItem> members = new LinkedHashMap<>();
        private int line;

        private ClassDraft(ClassItem header, Set<String> scope) {
            this.header = header;
            this.scope = scope;
        }
    }

    private static final class ParsedModifiers {
        private final ModifierSet.ModifierSetBuilder builder = ModifierSet.builder();
        private final Set<Modifier> flags = new HashSet<>();
        private Nullability nullability;

        private ModifierSet build() {
            return builder.build();
        }

        private TypeReference applyNullability(TypeReference type) {
            return nullability == null ? type : type.withNullability(nullability);
        }
    }
}
