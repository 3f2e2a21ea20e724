package toml.java21;

import java.util.Objects;

/// Layout choices for [Toml#format(String, TomlFormatOptions)].
///
/// Options only ever change whitespace, line breaks and trailing commas.
/// The text of keys, strings, numbers, dates and comments is copied as is.
///
/// @param spacesAroundEquals one space on each side of `=` in entries, otherwise none
/// @param spaceAfterComma one space after a comma that is followed by more content on the same line
/// @param compactArrays no padding inside the brackets of single-line arrays, otherwise `[ 1, 2 ]`
/// @param compactInlineTables no padding inside the braces of single-line inline tables, otherwise `{ a = 1 }`
/// @param compactKeys remove whitespace around the dots of dotted keys and inside header brackets
/// @param arrayTrailingComma add a trailing comma to multi-line arrays whose closing bracket is on its
///        own line and remove trailing commas from single-line arrays and inline tables
/// @param indentString one level of indentation
/// @param indentEntries indent entries and comments below a table header by one level
/// @param trimTrailingWhitespace drop whitespace at the end of lines. Lines holding only whitespace
///        are emptied either way and count as blank lines
/// @param allowedBlankLines the maximum number of consecutive blank lines kept
/// @param trailingNewline end non-empty output with exactly one line break
/// @param crlf use `\r\n` for line breaks outside string literals
/// @param commentSpacing number of spaces between code and a comment on the same line
public record TomlFormatOptions(
        boolean spacesAroundEquals,
        boolean spaceAfterComma,
        boolean compactArrays,
        boolean compactInlineTables,
        boolean compactKeys,
        boolean arrayTrailingComma,
        String indentString,
        boolean indentEntries,
        boolean trimTrailingWhitespace,
        int allowedBlankLines,
        boolean trailingNewline,
        boolean crlf,
        int commentSpacing) {

    private static final TomlFormatOptions DEFAULTS =
            new TomlFormatOptions(true, true, true, false, true, true, "  ", false, true, 2, true, false, 1);

    public TomlFormatOptions {
        Objects.requireNonNull(indentString, "indentString must not be null");
        if (!indentString.isBlank()) {
            throw new IllegalArgumentException("indentString must only contain whitespace: '" + indentString + "'");
        }
        if (indentString.contains("\n") || indentString.contains("\r")) {
            throw new IllegalArgumentException("indentString must not contain line breaks");
        }
        if (allowedBlankLines < 0) {
            throw new IllegalArgumentException("allowedBlankLines must not be negative: " + allowedBlankLines);
        }
        if (commentSpacing < 0) {
            throw new IllegalArgumentException("commentSpacing must not be negative: " + commentSpacing);
        }
    }

    public static TomlFormatOptions defaults() {
        return DEFAULTS;
    }

    public TomlFormatOptions withSpacesAroundEquals(boolean value) {
        return new TomlFormatOptions(value, spaceAfterComma, compactArrays, compactInlineTables, compactKeys,
                arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withSpaceAfterComma(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, value, compactArrays, compactInlineTables, compactKeys,
                arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withCompactArrays(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, value, compactInlineTables, compactKeys,
                arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withCompactInlineTables(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, value, compactKeys,
                arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withCompactKeys(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables, value,
                arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withArrayTrailingComma(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables,
                compactKeys, value, indentString, indentEntries, trimTrailingWhitespace, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withIndentString(String value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables,
                compactKeys, arrayTrailingComma, value, indentEntries, trimTrailingWhitespace, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withIndentEntries(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables,
                compactKeys, arrayTrailingComma, indentString, value, trimTrailingWhitespace, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withTrimTrailingWhitespace(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables,
                compactKeys, arrayTrailingComma, indentString, indentEntries, value, allowedBlankLines,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withAllowedBlankLines(int value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables,
                compactKeys, arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace, value,
                trailingNewline, crlf, commentSpacing);
    }

    public TomlFormatOptions withTrailingNewline(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables,
                compactKeys, arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace,
                allowedBlankLines, value, crlf, commentSpacing);
    }

    public TomlFormatOptions withCrlf(boolean value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables,
                compactKeys, arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace,
                allowedBlankLines, trailingNewline, value, commentSpacing);
    }

    public TomlFormatOptions withCommentSpacing(int value) {
        return new TomlFormatOptions(spacesAroundEquals, spaceAfterComma, compactArrays, compactInlineTables,
                compactKeys, arrayTrailingComma, indentString, indentEntries, trimTrailingWhitespace,
                allowedBlankLines, trailingNewline, crlf, value);
    }

    String lineBreak() {
        return crlf ? "\r\n" : "\n";
    }
}
