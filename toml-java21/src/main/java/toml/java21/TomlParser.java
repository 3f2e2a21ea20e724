package toml.java21;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive descent parser turning TOML text into a lossless [SyntaxTree].
///
/// Grammar, with trivia (whitespace, comments, newlines) kept as sibling
/// tokens inside the enclosing node:
/// - ROOT : (ENTRY | TABLE_HEADER | TABLE_ARRAY_HEADER | trivia)*
/// - ENTRY : KEY `=` VALUE
/// - KEY : part (`.` part)*, where a part is a bare, quoted or glob identifier
/// - VALUE : string | number | bool | date-time | ARRAY | INLINE_TABLE
/// - ARRAY : `[` (VALUE (`,` VALUE)* `,`?)? `]`
/// - INLINE_TABLE : `{` (ENTRY (`,` ENTRY)* `,`?)? `}`
/// - TABLE_HEADER : `[` KEY `]`, TABLE_ARRAY_HEADER : `[[` KEY `]]`
///
/// The parser never gives up. Unexpected input is wrapped in an `ERROR` node,
/// a [Diagnostic] is recorded and parsing resumes at the next line, or at the
/// next element inside arrays and inline tables.
final class TomlParser {

    private static final Logger LOG = Logger.getLogger(TomlParser.class.getName());

    /// Arrays and inline tables nested deeper than this are not descended into.
    static final int MAX_DEPTH = 256;

    private final String source;
    private final ParseOptions options;
    private final List<TomlLexer.LexedToken> tokens = new ArrayList<>();
    private final TreeBuilder builder = new TreeBuilder();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int index;
    private int depth;
    private boolean lineHasError;

    private TomlParser(String source, ParseOptions options) {
        this.source = source;
        this.options = options;
        new TomlLexer(source).forEachRemaining(tokens::add);
    }

    /// Parses a TOML document.
    /// @param source the document. Non-null.
    /// @param options parse options. Non-null.
    /// @return the tree and the diagnostics, never null
    static TomlParseResult parse(String source, ParseOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Parsing TOML document of " + source.length() + " chars");
        final var parser = new TomlParser(source, options);
        final var tree = parser.parseRoot();
        parser.diagnostics.sort(Comparator.comparingInt(Diagnostic::offset));
        LOG.fine(() -> "Parsed " + parser.tokens.size() + " tokens with " + parser.diagnostics.size() + " diagnostic(s)");
        return new TomlParseResult(tree, parser.diagnostics);
    }

    private SyntaxTree parseRoot() {
        builder.startNode(SyntaxKind.ROOT);
        while (!atEnd()) {
            switch (kind()) {
                case WHITESPACE, COMMENT -> bump();
                case NEWLINE -> {
                    bump();
                    lineHasError = false;
                }
                case BRACKET_START -> {
                    parseHeader();
                    finishLine("table header");
                }
                default -> {
                    if (startsKey(kind())) {
                        parseEntry();
                        finishLine("entry");
                    } else {
                        error("expected a key or a table header, found " + describe(current()));
                        recoverLine();
                    }
                }
            }
        }
        builder.finishNode();
        return builder.finish(source);
    }

    // ---------------------------------------------------------------- lines

    /// After an entry or header only whitespace and a comment may follow on the line.
    private void finishLine(String after) {
        skipWhitespace();
        if (at(SyntaxKind.COMMENT)) {
            bump();
        }
        if (atEnd() || at(SyntaxKind.NEWLINE)) {
            return;
        }
        if (!lineHasError) {
            error("expected a new line after the " + after + ", found " + describe(current()));
        }
        recoverLine();
    }

    /// Wraps everything up to the end of the line in an `ERROR` node.
    private void recoverLine() {
        LOG.finer(() -> "Recovering to end of line from offset " + current().start());
        builder.startNode(SyntaxKind.ERROR);
        while (!atEnd() && !at(SyntaxKind.NEWLINE)) {
            bump();
        }
        builder.finishNode();
    }

    // ---------------------------------------------------------------- headers and entries

    private void parseHeader() {
        final boolean arrayOfTables = kindAt(index + 1) == SyntaxKind.BRACKET_START;
        builder.startNode(arrayOfTables ? SyntaxKind.TABLE_ARRAY_HEADER : SyntaxKind.TABLE_HEADER);
        bump();
        if (arrayOfTables) {
            bump();
        }
        skipWhitespace();
        if (at(SyntaxKind.BRACKET_END)) {
            error("expected a table name");
        } else {
            parseKey();
        }
        skipWhitespace();
        if (arrayOfTables) {
            if (at(SyntaxKind.BRACKET_END) && kindAt(index + 1) == SyntaxKind.BRACKET_END) {
                bump();
                bump();
            } else if (!lineHasError) {
                error("expected ']]' to close the array of tables header, found " + describe(current()));
            }
        } else if (at(SyntaxKind.BRACKET_END)) {
            bump();
        } else if (!lineHasError) {
            error("expected ']' to close the table header, found " + describe(current()));
        }
        builder.finishNode();
    }

    private void parseEntry() {
        builder.startNode(SyntaxKind.ENTRY);
        parseKey();
        skipWhitespace();
        if (at(SyntaxKind.EQ)) {
            bump();
            skipWhitespace();
            parseValue();
        } else if (!lineHasError) {
            error("expected '=' after the key, found " + describe(current()));
        }
        builder.finishNode();
    }

    // ---------------------------------------------------------------- keys

    private void parseKey() {
        builder.startNode(SyntaxKind.KEY);
        if (parseKeyPart()) {
            while (true) {
                int next = index;
                while (kindAt(next) == SyntaxKind.WHITESPACE) {
                    next++;
                }
                if (kindAt(next) != SyntaxKind.PERIOD) {
                    break;
                }
                skipWhitespace();
                bump();
                skipWhitespace();
                if (!parseKeyPart()) {
                    break;
                }
            }
        }
        builder.finishNode();
    }

    /// @return false if no key part was found; the offending token is left in place
    private boolean parseKeyPart() {
        if (atEnd()) {
            error("expected a key, found end of input");
            return false;
        }
        final var token = current();
        switch (token.kind()) {
            case IDENT -> bump();
            case IDENT_WITH_GLOB -> {
                if (options.globKeys()) {
                    bump();
                } else {
                    error("glob patterns are not allowed in keys");
                    wrapError();
                }
            }
            case STRING, STRING_LITERAL -> {
                checkLiteral(token);
                bump();
            }
            case FLOAT -> {
                if (isBareKey(token.text(), true)) {
                    splitDottedKey(token);
                } else {
                    error("invalid key " + describe(token));
                    wrapError();
                }
            }
            case INTEGER, INTEGER_HEX, INTEGER_OCT, INTEGER_BIN, BOOL, DATE -> {
                if (isBareKey(token.text(), false)) {
                    bumpAs(SyntaxKind.IDENT);
                } else {
                    error("invalid key " + describe(token));
                    wrapError();
                }
            }
            case MULTI_LINE_STRING, MULTI_LINE_STRING_LITERAL -> {
                error("multi-line strings are not allowed in keys");
                wrapError();
            }
            default -> {
                error("expected a key, found " + describe(token));
                return false;
            }
        }
        return true;
    }

    /// A float such as `1.2` in key position is the dotted key `1` . `2`.
    private void splitDottedKey(TomlLexer.LexedToken token) {
        final var parts = token.text().split("\\.", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                builder.token(SyntaxKind.PERIOD, ".");
            }
            builder.token(SyntaxKind.IDENT, parts[i]);
        }
        index++;
    }

    private static boolean isBareKey(String text, boolean allowPeriods) {
        if (text.isEmpty() || text.startsWith(".") || text.endsWith(".") || text.contains("..")) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (!TomlLexer.isIdentChar(c) && !(allowPeriods && c == '.')) {
                return false;
            }
        }
        return true;
    }

    private static boolean startsKey(SyntaxKind kind) {
        return switch (kind) {
            case IDENT, IDENT_WITH_GLOB, STRING, STRING_LITERAL, INTEGER, INTEGER_HEX, INTEGER_OCT, INTEGER_BIN,
                 FLOAT, BOOL, DATE, MULTI_LINE_STRING, MULTI_LINE_STRING_LITERAL -> true;
            default -> false;
        };
    }

    // ---------------------------------------------------------------- values

    private void parseValue() {
        if (atEnd() || at(SyntaxKind.NEWLINE) || at(SyntaxKind.COMMENT)) {
            error("expected a value, found " + describe(current()));
            return;
        }
        final var token = current();
        final var kind = token.kind();

        if (kind.isScalarValue()) {
            if (unterminatedMultiLine(token)) {
                error("unterminated multi-line string");
            }
            builder.startNode(SyntaxKind.VALUE);
            checkLiteral(token);
            bump();
            builder.finishNode();
            return;
        }

        switch (kind) {
            case IDENT -> {
                if (token.text().equals("nan") || token.text().equals("inf")) {
                    builder.startNode(SyntaxKind.VALUE);
                    bumpAs(SyntaxKind.FLOAT);
                    builder.finishNode();
                } else {
                    error("invalid value " + describe(token) + ", strings must be quoted");
                    wrapError();
                }
            }
            case BRACKET_START, BRACE_START -> {
                if (depth >= MAX_DEPTH) {
                    error("arrays and inline tables are nested too deeply");
                    wrapError();
                    return;
                }
                depth++;
                builder.startNode(SyntaxKind.VALUE);
                if (kind == SyntaxKind.BRACKET_START) {
                    parseArray();
                } else {
                    parseInlineTable();
                }
                builder.finishNode();
                depth--;
            }
            case COMMA, BRACKET_END, BRACE_END -> error("expected a value, found " + describe(token));
            default -> {
                error("expected a value, found " + describe(token));
                wrapError();
            }
        }
    }

    private void parseArray() {
        final int open = current().start();
        builder.startNode(SyntaxKind.ARRAY);
        bump();
        boolean needsValue = true;
        while (true) {
            skipTrivia();
            if (atEnd()) {
                error(open, open + 1, "unclosed array");
                break;
            }
            final var kind = kind();
            if (kind == SyntaxKind.BRACKET_END) {
                bump();
                break;
            }
            if (kind == SyntaxKind.COMMA) {
                if (needsValue) {
                    error("expected a value before ','");
                }
                bump();
                needsValue = true;
                continue;
            }
            if (!needsValue) {
                error("expected ',' between array values, found " + describe(current()));
            }
            final int before = index;
            parseValue();
            if (index == before) {
                wrapError();
            }
            needsValue = false;
        }
        builder.finishNode();
    }

    private void parseInlineTable() {
        final int open = current().start();
        builder.startNode(SyntaxKind.INLINE_TABLE);
        bump();
        boolean needsEntry = true;
        while (true) {
            skipTrivia();
            if (atEnd()) {
                error(open, open + 1, "unclosed inline table");
                break;
            }
            final var kind = kind();
            if (kind == SyntaxKind.BRACE_END) {
                bump();
                break;
            }
            if (kind == SyntaxKind.COMMA) {
                if (needsEntry) {
                    error("expected a key before ','");
                }
                bump();
                needsEntry = true;
                continue;
            }
            if (!needsEntry) {
                error("expected ',' between inline table entries, found " + describe(current()));
            }
            final int before = index;
            if (startsKey(kind)) {
                parseEntry();
            } else {
                error("expected a key, found " + describe(current()));
            }
            if (index == before) {
                wrapError();
            }
            needsEntry = false;
        }
        builder.finishNode();
    }

    /// An unterminated `"""` lexes as the empty string `""` directly followed
    /// by a stray quote.
    private boolean unterminatedMultiLine(TomlLexer.LexedToken token) {
        if (!token.text().equals("\"\"") && !token.text().equals("''")) {
            return false;
        }
        final var next = index + 1 < tokens.size() ? tokens.get(index + 1) : null;
        return next != null && next.text().charAt(0) == token.text().charAt(0);
    }

    // ---------------------------------------------------------------- literal content

    /// Reports invalid escapes, control characters and malformed numbers.
    private void checkLiteral(TomlLexer.LexedToken token) {
        final var text = token.text();
        switch (token.kind()) {
            case STRING -> {
                report(token.start() + 1, TomlEscapes.checkEscape(body(text, 1)), "invalid escape sequence");
                report(token.start() + 1, TomlChars.string(body(text, 1)), "control character not allowed in string");
            }
            case MULTI_LINE_STRING -> {
                report(token.start() + 3, TomlEscapes.checkEscape(body(text, 3)), "invalid escape sequence");
                report(token.start() + 3, TomlChars.multiLineString(body(text, 3)), "control character not allowed in string");
            }
            case STRING_LITERAL ->
                    report(token.start() + 1, TomlChars.stringLiteral(body(text, 1)), "control character not allowed in string");
            case MULTI_LINE_STRING_LITERAL ->
                    report(token.start() + 3, TomlChars.multiLineStringLiteral(body(text, 3)), "control character not allowed in string");
            default -> TomlNumbers.check(token.kind(), text)
                    .ifPresent(message -> addDiagnostic(token.start(), token.end(), message));
        }
    }

    private static String body(String text, int delimiter) {
        return text.substring(delimiter, text.length() - delimiter);
    }

    private void report(int base, List<Integer> offsets, String message) {
        for (int offset : offsets) {
            addDiagnostic(base + offset, base + offset + 1, message);
        }
    }

    // ---------------------------------------------------------------- token plumbing

    private TomlLexer.LexedToken current() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private SyntaxKind kind() {
        return kindAt(index);
    }

    private SyntaxKind kindAt(int i) {
        return i < tokens.size() ? tokens.get(i).kind() : null;
    }

    private boolean at(SyntaxKind kind) {
        return kind() == kind;
    }

    private boolean atEnd() {
        return index >= tokens.size();
    }

    private void bump() {
        bumpAs(current().kind());
    }

    private void bumpAs(SyntaxKind kind) {
        final var token = tokens.get(index++);
        if (kind == SyntaxKind.COMMENT) {
            report(token.start(), TomlChars.comment(token.text()), "control character not allowed in comment");
        }
        builder.token(kind, token.text());
    }

    private void wrapError() {
        builder.startNode(SyntaxKind.ERROR);
        bump();
        builder.finishNode();
    }

    private void skipWhitespace() {
        while (at(SyntaxKind.WHITESPACE)) {
            bump();
        }
    }

    private void skipTrivia() {
        while (!atEnd() && kind().isTrivia()) {
            bump();
        }
    }

    // ---------------------------------------------------------------- diagnostics

    /// Records a syntax error at the current token.
    private void error(String message) {
        final var token = current();
        if (token == null) {
            error(source.length(), source.length(), message);
        } else {
            error(token.start(), token.end(), message);
        }
    }

    private void error(int start, int end, String message) {
        lineHasError = true;
        addDiagnostic(start, end, message);
    }

    private void addDiagnostic(int start, int end, String message) {
        LOG.finer(() -> "Diagnostic at " + start + ": " + message);
        diagnostics.add(new Diagnostic(new Span(start, end), message));
    }

    private static String describe(TomlLexer.LexedToken token) {
        if (token == null) {
            return "end of input";
        }
        return switch (token.kind()) {
            case NEWLINE -> "end of line";
            case COMMENT -> "comment";
            case ERROR -> token.text().equals("\"") || token.text().equals("'")
                    ? "unterminated string"
                    : "unexpected character '" + token.text() + "'";
            default -> "'" + token.text() + "'";
        };
    }
}
