package toml.java21;

/// Exception thrown by [TomlParseResult#requireValid()] when a document has
/// syntax errors. Parsing itself never throws this; it reports diagnostics.
public class TomlParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int position;
    private final transient String source;

    /// Creates a new parse exception with the given message.
    public TomlParseException(String message) {
        super(message);
        this.position = -1;
        this.source = null;
    }

    /// Creates a new parse exception with position information.
    /// @param message the first problem found
    /// @param source the document being parsed
    /// @param position char offset of the problem
    /// @param count total number of problems found
    public TomlParseException(String message, String source, int position, int count) {
        super(formatMessage(message, source, position, count));
        this.position = position;
        this.source = source;
    }

    /// Returns the char offset where the error occurred, or -1 if unknown.
    public int position() {
        return position;
    }

    /// Returns the document that was being parsed, or null if unknown.
    public String source() {
        return source;
    }

    private static String formatMessage(String message, String source, int position, int count) {
        if (source == null || position < 0) {
            return message;
        }
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < position && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(position);
        sb.append(" (line ").append(line).append(", column ").append(position - lineStart + 1).append(')');
        if (position < source.length() && !Character.isISOControl(source.charAt(position))) {
            sb.append(" near '").append(source.charAt(position)).append('\'');
        }
        if (count > 1) {
            sb.append(" and ").append(count - 1).append(" more error(s)");
        }
        return sb.toString();
    }
}
