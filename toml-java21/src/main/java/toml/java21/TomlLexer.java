package toml.java21;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.logging.Logger;

/// Hand-written maximal-munch lexer for TOML.
///
/// [#lex(String, int)] classifies the text at an offset by trying the rules
/// below in a fixed priority order:
/// 1. single-char punctuation `. , = [ ] { }`
/// 2. horizontal whitespace
/// 3. newline runs (`\n`, or `\r\n` pairs)
/// 4. comments, up to the line terminator
/// 5. multi-line strings, tried before
/// 6. single-line strings
/// 7. `true` / `false`
/// 8. dates and times, `nan`/`inf`, prefixed integers, decimal numbers
/// 9. bare identifiers
/// 10. identifiers containing the glob characters `*` and `?`
///
/// When a bare identifier run is strictly longer than a keyword or number
/// match (`trueish`, `123abc`) the identifier wins.
///
/// As an iterator the lexer is total: text no rule accepts becomes an `ERROR`
/// token of exactly one code point, so it always makes progress.
final class TomlLexer implements Iterator<TomlLexer.LexedToken> {

    private static final Logger LOG = Logger.getLogger(TomlLexer.class.getName());

    /// Kind and length of a successful match.
    record Match(SyntaxKind kind, int length) {}

    /// A token cut from the source.
    record LexedToken(SyntaxKind kind, int start, String text) {
        int end() {
            return start + text.length();
        }
    }

    private final String source;
    private int pos;

    TomlLexer(String source) {
        this.source = source;
    }

    @Override
    public boolean hasNext() {
        return pos < source.length();
    }

    @Override
    public LexedToken next() {
        if (pos >= source.length()) {
            throw new NoSuchElementException();
        }
        final int start = pos;
        final var match = lex(source, pos);
        final SyntaxKind kind;
        if (match != null) {
            kind = match.kind();
            pos += match.length();
        } else {
            kind = SyntaxKind.ERROR;
            pos += Character.charCount(source.codePointAt(pos));
        }
        final var token = new LexedToken(kind, start, source.substring(start, pos));
        LOG.finest(() -> "Lexed " + token.kind() + " at " + start);
        return token;
    }

    /// Matches the token starting at `pos`.
    /// @return the match, or null if no rule accepts the text at `pos`
    static Match lex(String s, int pos) {
        if (pos >= s.length()) {
            return null;
        }
        final char first = s.charAt(pos);

        final SyntaxKind punctuation = switch (first) {
            case '.' -> SyntaxKind.PERIOD;
            case ',' -> SyntaxKind.COMMA;
            case '=' -> SyntaxKind.EQ;
            case '[' -> SyntaxKind.BRACKET_START;
            case ']' -> SyntaxKind.BRACKET_END;
            case '{' -> SyntaxKind.BRACE_START;
            case '}' -> SyntaxKind.BRACE_END;
            default -> null;
        };
        if (punctuation != null) {
            return new Match(punctuation, 1);
        }

        if (isWhitespace(first)) {
            int i = pos;
            while (i < s.length() && isWhitespace(s.charAt(i))) {
                i++;
            }
            return new Match(SyntaxKind.WHITESPACE, i - pos);
        }

        if (first == '\n') {
            int i = pos;
            while (i < s.length() && s.charAt(i) == '\n') {
                i++;
            }
            return new Match(SyntaxKind.NEWLINE, i - pos);
        }
        if (first == '\r' && s.startsWith("\r\n", pos)) {
            int i = pos;
            while (s.startsWith("\r\n", i)) {
                i += 2;
            }
            return new Match(SyntaxKind.NEWLINE, i - pos);
        }

        if (first == '#') {
            int i = pos;
            while (i < s.length() && s.charAt(i) != '\n' && s.charAt(i) != '\r') {
                i++;
            }
            return new Match(SyntaxKind.COMMENT, i - pos);
        }

        if (s.startsWith("\"\"\"", pos)) {
            final int len = multiLineString(s, pos + 3, '"', true);
            if (len >= 0) {
                return new Match(SyntaxKind.MULTI_LINE_STRING, 3 + len);
            }
        }
        if (s.startsWith("'''", pos)) {
            final int len = multiLineString(s, pos + 3, '\'', false);
            if (len >= 0) {
                return new Match(SyntaxKind.MULTI_LINE_STRING_LITERAL, 3 + len);
            }
        }

        if (first == '"') {
            final int len = basicString(s, pos + 1);
            if (len >= 0) {
                return new Match(SyntaxKind.STRING, 1 + len);
            }
        }
        if (first == '\'') {
            final int len = literalString(s, pos + 1);
            if (len >= 0) {
                return new Match(SyntaxKind.STRING_LITERAL, 1 + len);
            }
        }

        final var identifier = identifier(s, pos);

        if (s.startsWith("true", pos)) {
            return longest(identifier, new Match(SyntaxKind.BOOL, 4));
        }
        if (s.startsWith("false", pos)) {
            return longest(identifier, new Match(SyntaxKind.BOOL, 5));
        }

        if (isDigit(first) || first == '+' || first == '-') {
            final var number = numberOrDate(s, pos);
            if (number != null) {
                return longest(identifier, number);
            }
        }

        return identifier;
    }

    /// Prefers the identifier only when it is strictly longer.
    private static Match longest(Match identifier, Match other) {
        if (identifier != null && identifier.length() > other.length()) {
            return identifier;
        }
        return other;
    }

    private static Match identifier(String s, int pos) {
        int plain = pos;
        while (plain < s.length() && isIdentChar(s.charAt(plain))) {
            plain++;
        }
        int glob = plain;
        while (glob < s.length() && isIdentWithGlobChar(s.charAt(glob))) {
            glob++;
        }
        if (glob > plain) {
            return new Match(SyntaxKind.IDENT_WITH_GLOB, glob - pos);
        }
        if (plain > pos) {
            return new Match(SyntaxKind.IDENT, plain - pos);
        }
        return null;
    }

    private static Match numberOrDate(String s, int pos) {
        final var dateTime = TomlDateTimes.match(s, pos);
        if (dateTime != null) {
            return dateTime;
        }

        final char first = s.charAt(pos);
        final boolean signed = first == '+' || first == '-';
        final int unsigned = signed ? pos + 1 : pos;
        if (s.startsWith("nan", unsigned) || s.startsWith("inf", unsigned)) {
            return new Match(SyntaxKind.FLOAT, signed ? 4 : 3);
        }

        if (s.startsWith("0x", pos)) {
            final int len = run(s, pos + 2, TomlLexer::isHexDigitOrUnderscore);
            if (len > 0) {
                return new Match(SyntaxKind.INTEGER_HEX, 2 + len);
            }
        }
        if (s.startsWith("0o", pos)) {
            final int len = run(s, pos + 2, c -> (c >= '0' && c <= '7') || c == '_');
            if (len > 0) {
                return new Match(SyntaxKind.INTEGER_OCT, 2 + len);
            }
        }
        if (s.startsWith("0b", pos)) {
            final int len = run(s, pos + 2, c -> c == '0' || c == '1' || c == '_');
            if (len > 0) {
                return new Match(SyntaxKind.INTEGER_BIN, 2 + len);
            }
        }

        return decimal(s, pos);
    }

    private static Match decimal(String s, int pos) {
        int i = pos;
        if (i < s.length() && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
            i++;
        }
        final int intDigits = run(s, i, TomlLexer::isDigitOrUnderscore);
        if (intDigits == 0) {
            return null;
        }
        i += intDigits;

        boolean isFloat = false;
        // a period only belongs to the number when a digit follows it
        if (i + 1 < s.length() && s.charAt(i) == '.' && isDigit(s.charAt(i + 1))) {
            isFloat = true;
            i++;
            i += run(s, i, TomlLexer::isDigitOrUnderscore);
        }

        if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            isFloat = true;
            i++;
            if (i < s.length() && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
                i++;
            }
            final int expDigits = run(s, i, TomlLexer::isDigitOrUnderscore);
            if (expDigits == 0) {
                return null;
            }
            i += expDigits;
        }

        return new Match(isFloat ? SyntaxKind.FLOAT : SyntaxKind.INTEGER, i - pos);
    }

    /// Length of a basic string body including the closing quote, or -1.
    private static int basicString(String s, int start) {
        boolean escaped = false;
        for (int i = start; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == '\n') {
                return -1;
            }
            if (c == '\\') {
                escaped = !escaped;
                continue;
            }
            if (c == '"' && !escaped) {
                return i + 1 - start;
            }
            escaped = false;
        }
        return -1;
    }

    /// Length of a literal string body including the closing quote, or -1.
    private static int literalString(String s, int start) {
        for (int i = start; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == '\n') {
                return -1;
            }
            if (c == '\'') {
                return i + 1 - start;
            }
        }
        return -1;
    }

    /// Length of a multi-line string body including the closing delimiter, or -1.
    ///
    /// The body may end with up to two quotes of its own, so once three quotes
    /// arm the terminator up to five contiguous quotes are accepted. Six or
    /// more leave the literal unterminated.
    private static int multiLineString(String s, int start, char quote, boolean escapes) {
        int quoteCount = 0;
        boolean escaped = false;
        boolean armed = false;
        int i = start;

        while (i < s.length()) {
            final char c = s.charAt(i);
            if (armed) {
                if (c != quote) {
                    return quoteCount >= 6 ? -1 : i - start;
                }
                quoteCount++;
                i++;
                continue;
            }
            i++;

            if (escapes && c == '\\') {
                escaped = !escaped;
                quoteCount = 0;
                continue;
            }
            if (c == quote && !escaped) {
                quoteCount++;
            } else {
                quoteCount = 0;
            }
            if (quoteCount == 3) {
                armed = true;
            }
            escaped = false;
        }

        if (armed && quoteCount < 6) {
            return i - start;
        }
        return -1;
    }

    private interface CharPredicate {
        boolean test(char c);
    }

    private static int run(String s, int start, CharPredicate predicate) {
        int i = start;
        while (i < s.length() && predicate.test(s.charAt(i))) {
            i++;
        }
        return i - start;
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isDigitOrUnderscore(char c) {
        return isDigit(c) || c == '_';
    }

    private static boolean isHexDigitOrUnderscore(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F') || c == '_';
    }

    /// @return true for the characters of a bare key
    static boolean isIdentChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c) || c == '_' || c == '-';
    }

    static boolean isIdentWithGlobChar(char c) {
        return isIdentChar(c) || c == '*' || c == '?';
    }
}
