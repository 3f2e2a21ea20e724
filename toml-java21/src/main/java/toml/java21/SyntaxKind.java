package toml.java21;

/// All token and node kinds that appear in a TOML syntax tree.
///
/// Leaf kinds are produced by the lexer, composite kinds are only ever
/// created by the parser. `ERROR` is shared: the lexer emits it for a
/// character no rule accepts and the parser uses it for nodes wrapping
/// unexpected input.
public enum SyntaxKind {
    WHITESPACE,
    NEWLINE,
    COMMENT,
    IDENT,
    /// Not part of TOML, only used to allow glob patterns such as `dep*` in keys.
    IDENT_WITH_GLOB,
    PERIOD,
    COMMA,
    EQ,
    STRING,
    MULTI_LINE_STRING,
    STRING_LITERAL,
    MULTI_LINE_STRING_LITERAL,
    INTEGER,
    INTEGER_HEX,
    INTEGER_OCT,
    INTEGER_BIN,
    FLOAT,
    BOOL,
    DATE_TIME_OFFSET,
    DATE_TIME_LOCAL,
    DATE,
    TIME,
    BRACKET_START,
    BRACKET_END,
    BRACE_START,
    BRACE_END,
    ERROR,

    // composite kinds
    KEY,                // parent.child
    VALUE,              // "2"
    TABLE_HEADER,       // [table]
    TABLE_ARRAY_HEADER, // [[table]]
    ENTRY,              // key = "value"
    ARRAY,              // [ 1, 2 ]
    INLINE_TABLE,       // { key = "value" }

    ROOT;

    /// @return true for kinds only the parser creates
    public boolean isComposite() {
        return ordinal() >= KEY.ordinal();
    }

    /// @return true for whitespace, newlines and comments
    public boolean isTrivia() {
        return this == WHITESPACE || this == NEWLINE || this == COMMENT;
    }

    /// @return true for the four string token kinds
    public boolean isString() {
        return this == STRING || this == MULTI_LINE_STRING
                || this == STRING_LITERAL || this == MULTI_LINE_STRING_LITERAL;
    }

    /// @return true for integer and float token kinds
    public boolean isNumber() {
        return this == INTEGER || this == INTEGER_HEX || this == INTEGER_OCT
                || this == INTEGER_BIN || this == FLOAT;
    }

    /// @return true for the four date and time token kinds
    public boolean isDateTime() {
        return this == DATE_TIME_OFFSET || this == DATE_TIME_LOCAL || this == DATE || this == TIME;
    }

    /// @return true for any token kind that is a complete value on its own
    public boolean isScalarValue() {
        return isString() || isNumber() || isDateTime() || this == BOOL;
    }
}
