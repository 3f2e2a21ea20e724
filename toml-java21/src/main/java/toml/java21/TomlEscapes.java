package toml.java21;

import java.util.ArrayList;
import java.util.List;

/// Validation of escape sequences in the body of a basic string.
///
/// Recognized escapes:
///
/// | Escape | Meaning |
/// |--------|---------|
/// | `\b` | backspace (U+0008) |
/// | `\t` | tab (U+0009) |
/// | `\n` | linefeed (U+000A) |
/// | `\f` | form feed (U+000C) |
/// | `\r` | carriage return (U+000D) |
/// | `\"` | quote (U+0022) |
/// | `\\` | backslash (U+005C) |
/// | `\\uXXXX` | unicode scalar value U+XXXX |
/// | `\UXXXXXXXX` | unicode scalar value U+XXXXXXXX |
/// | `\` + whitespace + newline | line continuation (multi-line strings) |
public final class TomlEscapes {

    private TomlEscapes() {}

    /// Escape sequence kinds, tried from the top down.
    enum Escape {
        SIMPLE,
        LINE_CONTINUATION,
        UNICODE,
        UNICODE_LARGE,
        UNKNOWN,
        UNESCAPED
    }

    /// Checks every escape sequence in `body`, the text between the quotes of a
    /// basic string. Unlike an unescaper this does not stop at the first problem.
    ///
    /// @param body the string body. Non-null.
    /// @return the offsets into `body` of every invalid escape in ascending
    ///         order; empty if all escapes are valid
    public static List<Integer> checkEscape(String body) {
        final var invalid = new ArrayList<Integer>();
        int i = 0;
        while (i < body.length()) {
            final var escape = classify(body, i);
            final int length = length(escape, body, i);
            switch (escape) {
                case UNICODE, UNICODE_LARGE -> {
                    if (!isScalarValue(Long.parseLong(body.substring(i + 2, i + length), 16))) {
                        invalid.add(i);
                    }
                }
                case UNKNOWN -> invalid.add(i);
                default -> {
                }
            }
            i += length;
        }
        return invalid;
    }

    static Escape classify(String s, int i) {
        if (s.charAt(i) != '\\') {
            return Escape.UNESCAPED;
        }
        if (i + 1 < s.length() && "btnfr\"\\".indexOf(s.charAt(i + 1)) >= 0) {
            return Escape.SIMPLE;
        }
        if (continuationLength(s, i) > 0) {
            return Escape.LINE_CONTINUATION;
        }
        if (s.startsWith("\\u", i) && hexDigits(s, i + 2, 4)) {
            return Escape.UNICODE;
        }
        if (s.startsWith("\\U", i) && hexDigits(s, i + 2, 8)) {
            return Escape.UNICODE_LARGE;
        }
        return Escape.UNKNOWN;
    }

    private static int length(Escape escape, String s, int i) {
        return switch (escape) {
            case SIMPLE -> 2;
            case LINE_CONTINUATION -> continuationLength(s, i);
            case UNICODE -> 6;
            case UNICODE_LARGE -> 10;
            // a trailing lone backslash is only one char long
            case UNKNOWN -> i + 1 < s.length() ? 1 + Character.charCount(s.codePointAt(i + 1)) : 1;
            case UNESCAPED -> Character.charCount(s.codePointAt(i));
        };
    }

    /// `\` followed by spaces or tabs and a newline, or 0 if absent.
    private static int continuationLength(String s, int i) {
        int j = i + 1;
        while (j < s.length() && TomlLexer.isWhitespace(s.charAt(j))) {
            j++;
        }
        if (s.startsWith("\n", j)) {
            return j + 1 - i;
        }
        if (s.startsWith("\r\n", j)) {
            return j + 2 - i;
        }
        return 0;
    }

    private static boolean hexDigits(String s, int start, int count) {
        if (start + count > s.length()) {
            return false;
        }
        for (int i = start; i < start + count; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /// @return true if `value` is a code point outside the surrogate range
    static boolean isScalarValue(long value) {
        return value <= Character.MAX_CODE_POINT
                && (value < Character.MIN_SURROGATE || value > Character.MAX_SURROGATE);
    }
}
