package toml.java21;

import java.util.ArrayList;
import java.util.List;

/// Control character checks for comments and string bodies.
///
/// Tab is allowed everywhere. Line feed and carriage return are only allowed
/// in multi-line strings. Every other C0 control (U+0000 to U+001F) and DEL
/// (U+007F) is rejected. Each check returns the offsets of all offending
/// chars in ascending order, or an empty list when the text is clean.
public final class TomlChars {

    private TomlChars() {}

    /// @param text a comment including its leading `#`
    public static List<Integer> comment(String text) {
        return disallowed(text, false);
    }

    /// @param body the body of a basic string, without quotes
    public static List<Integer> string(String body) {
        return disallowed(body, false);
    }

    /// @param body the body of a multi-line basic string, without delimiters
    public static List<Integer> multiLineString(String body) {
        return disallowed(body, true);
    }

    /// @param body the body of a literal string, without quotes
    public static List<Integer> stringLiteral(String body) {
        return disallowed(body, false);
    }

    /// @param body the body of a multi-line literal string, without delimiters
    public static List<Integer> multiLineStringLiteral(String body) {
        return disallowed(body, true);
    }

    private static List<Integer> disallowed(String text, boolean multiLine) {
        final var offsets = new ArrayList<Integer>();
        for (int i = 0; i < text.length(); i++) {
            if (!allowed(text.charAt(i), multiLine)) {
                offsets.add(i);
            }
        }
        return offsets;
    }

    static boolean allowed(char c, boolean multiLine) {
        if (c == '\t') {
            return true;
        }
        if (c == '\n' || c == '\r') {
            return multiLine;
        }
        return c >= 0x20 && c != 0x7F;
    }
}
