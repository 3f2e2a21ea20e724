package toml.java21;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Pretty printer working on the lossless syntax tree.
///
/// The document is processed one logical line at a time, a logical line being
/// the top level elements between two newline tokens. A logical line that holds
/// an `ERROR` node or a [Diagnostic] is copied unchanged apart from trailing
/// whitespace, everything else is laid out again from its tokens.
final class TomlFormatter {

    private static final Logger LOG = Logger.getLogger(TomlFormatter.class.getName());

    private final TomlFormatOptions options;
    private final TomlParseResult parsed;
    private final String source;
    private final String nl;
    private final StringBuilder out = new StringBuilder();
    private boolean started;
    private int pendingBreaks;
    private boolean inTable;
    private int nextDiagnostic;

    private TomlFormatter(TomlParseResult parsed, TomlFormatOptions options) {
        this.parsed = parsed;
        this.options = options;
        this.source = parsed.tree().source();
        this.nl = options.lineBreak();
    }

    static String format(String source, TomlFormatOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        final var parsed = TomlParser.parse(source, ParseOptions.defaults());
        LOG.fine(() -> "Formatting TOML document of " + source.length() + " chars with "
                + parsed.diagnostics().size() + " diagnostic(s)");
        return new TomlFormatter(parsed, options).formatRoot();
    }

    private String formatRoot() {
        final var line = new ArrayList<SyntaxElement>();
        for (SyntaxElement child : parsed.tree().root().children()) {
            if (child.kind() == SyntaxKind.NEWLINE) {
                flushLine(line);
                line.clear();
                breaks(lineBreaks(child));
            } else {
                line.add(child);
            }
        }
        flushLine(line);
        if (started && options.trailingNewline() && !endsWithLineBreak()) {
            out.append(nl);
        }
        return out.toString();
    }

    // ---------------------------------------------------------------- output

    private void breaks(int count) {
        if (started) {
            pendingBreaks += count;
        }
    }

    /// A verbatim line may end in a line break or a bare CR; no final line break follows either.
    private boolean endsWithLineBreak() {
        final char last = out.charAt(out.length() - 1);
        return last == '\n' || last == '\r';
    }

    private void emitLine(String content) {
        if (content.isEmpty()) {
            return;
        }
        if (started) {
            // after a bare CR a LF would turn it into a CRLF
            out.append(out.charAt(out.length() - 1) == '\r' ? "\r\n" : nl);
            final int blanks = Math.min(Math.max(pendingBreaks - 1, 0), options.allowedBlankLines());
            out.append(nl.repeat(blanks));
        }
        out.append(content);
        started = true;
        pendingBreaks = 0;
    }

    /// Removes trailing spaces and tabs only.
    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && TomlLexer.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    /// Removes the line breaks an unclosed container swallowed at the end of
    /// the input, and trailing blanks when trimming. Neither step may leave a
    /// bare CR at the end that was followed by something.
    private String trimVerbatim(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            int breakStart = end - 1;
            if (breakStart > 0 && text.charAt(breakStart - 1) == '\r') {
                breakStart--;
            }
            if (breakStart > 0 && text.charAt(breakStart - 1) == '\r') {
                break;
            }
            end = breakStart;
        }
        final var content = text.substring(0, end);
        if (!options.trimTrailingWhitespace()) {
            return content;
        }
        final var stripped = stripTrailing(content);
        return stripped.endsWith("\r") ? content : stripped;
    }

    private String comment(SyntaxElement comment) {
        final var text = comment.text(source);
        return options.trimTrailingWhitespace() ? stripTrailing(text) : text;
    }

    private int lineBreaks(SyntaxElement newline) {
        final var text = newline.text(source);
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private String indent(int level) {
        return options.indentString().repeat(level);
    }

    // ---------------------------------------------------------------- logical lines

    private void flushLine(List<SyntaxElement> line) {
        if (line.isEmpty()) {
            return;
        }
        if (isMalformed(line)) {
            LOG.finer(() -> "Copying malformed line at " + line.get(0).span().start() + " verbatim");
            verbatim(line);
            return;
        }

        SyntaxNode item = null;
        SyntaxElement comment = null;
        for (SyntaxElement element : line) {
            if (element instanceof SyntaxNode node) {
                item = node;
            } else if (element.kind() == SyntaxKind.COMMENT) {
                comment = element;
            }
        }

        final var sb = new StringBuilder();
        final boolean header = item != null && item.kind() != SyntaxKind.ENTRY;
        if (header) {
            inTable = true;
            header(item, sb);
        } else if (item != null || comment != null) {
            final int level = options.indentEntries() && inTable ? 1 : 0;
            sb.append(indent(level));
            if (item != null) {
                entry(item, level, sb);
            }
        }
        if (comment != null) {
            if (item != null) {
                sb.append(" ".repeat(options.commentSpacing()));
            }
            sb.append(comment(comment));
        }
        final var last = line.get(line.size() - 1);
        if (!options.trimTrailingWhitespace() && sb.length() > 0 && last.kind() == SyntaxKind.WHITESPACE) {
            sb.append(last.text(source));
        }
        emitLine(options.trimTrailingWhitespace() ? stripTrailing(sb.toString()) : sb.toString());
    }

    private boolean isMalformed(List<SyntaxElement> line) {
        for (SyntaxElement element : line) {
            if (element.kind() == SyntaxKind.ERROR
                    || element instanceof SyntaxNode node && node.containsError()) {
                return true;
            }
        }
        // lines arrive in source order and diagnostics are sorted by offset
        final int start = line.get(0).span().start();
        final int end = line.get(line.size() - 1).span().end();
        final var diagnostics = parsed.diagnostics();
        while (nextDiagnostic < diagnostics.size() && diagnostics.get(nextDiagnostic).offset() < start) {
            nextDiagnostic++;
        }
        return nextDiagnostic < diagnostics.size() && diagnostics.get(nextDiagnostic).offset() <= end;
    }

    private void verbatim(List<SyntaxElement> line) {
        final var sb = new StringBuilder();
        for (SyntaxElement element : line) {
            if (element.kind() == SyntaxKind.TABLE_HEADER || element.kind() == SyntaxKind.TABLE_ARRAY_HEADER) {
                inTable = true;
            }
            sb.append(element.text(source));
        }
        emitLine(trimVerbatim(sb.toString()));
    }

    // ---------------------------------------------------------------- items

    private void header(SyntaxNode node, StringBuilder sb) {
        if (!options.compactKeys()) {
            sb.append(node.text(source));
            return;
        }
        final boolean arrayOfTables = node.kind() == SyntaxKind.TABLE_ARRAY_HEADER;
        sb.append(arrayOfTables ? "[[" : "[");
        node.childNode(SyntaxKind.KEY).ifPresent(key -> key(key, sb));
        sb.append(arrayOfTables ? "]]" : "]");
    }

    private void entry(SyntaxNode node, int level, StringBuilder sb) {
        node.childNode(SyntaxKind.KEY).ifPresent(key -> key(key, sb));
        sb.append(options.spacesAroundEquals() ? " = " : "=");
        node.childNode(SyntaxKind.VALUE).ifPresent(value -> value(value, level, sb));
    }

    private void key(SyntaxNode node, StringBuilder sb) {
        if (!options.compactKeys()) {
            sb.append(node.text(source));
            return;
        }
        for (SyntaxElement child : node.children()) {
            if (child.kind() != SyntaxKind.WHITESPACE) {
                sb.append(child.text(source));
            }
        }
    }

    private void value(SyntaxNode node, int level, StringBuilder sb) {
        final var container = node.childNode(SyntaxKind.ARRAY).or(() -> node.childNode(SyntaxKind.INLINE_TABLE));
        if (container.isPresent()) {
            container(container.get(), level, sb);
        } else {
            sb.append(node.text(source));
        }
    }

    // ---------------------------------------------------------------- arrays and inline tables

    /// Element of a container body: an item, a comma, a comment or a line break.
    private record Part(SyntaxElement element) {
        SyntaxKind kind() {
            return element.kind();
        }

        boolean isItem() {
            return element instanceof SyntaxNode;
        }
    }

    private void container(SyntaxNode node, int level, StringBuilder sb) {
        final boolean array = node.kind() == SyntaxKind.ARRAY;
        final String open = array ? "[" : "{";
        final String close = array ? "]" : "}";

        final var children = node.children();
        final var parts = new ArrayList<Part>();
        for (int i = 1; i < children.size() - 1; i++) {
            final var child = children.get(i);
            if (child.kind() != SyntaxKind.WHITESPACE) {
                parts.add(new Part(child));
            }
        }

        final boolean multiLine = parts.stream().anyMatch(p -> p.kind() == SyntaxKind.NEWLINE);
        if (!multiLine) {
            if (options.arrayTrailingComma()) {
                removeTrailingComma(parts);
            }
            if (parts.isEmpty()) {
                sb.append(open).append(close);
                return;
            }
            final boolean compact = array ? options.compactArrays() : options.compactInlineTables();
            final String pad = compact ? "" : " ";
            sb.append(open).append(pad);
            segment(parts, level, false, sb);
            sb.append(pad).append(close);
            return;
        }

        final boolean closeOnOwnLine = parts.get(parts.size() - 1).kind() == SyntaxKind.NEWLINE;
        if (array && closeOnOwnLine && options.arrayTrailingComma()) {
            addTrailingComma(parts);
        }

        sb.append(open);
        final var current = new ArrayList<Part>();
        boolean first = true;
        int breaks = 0;
        for (Part part : parts) {
            if (part.kind() != SyntaxKind.NEWLINE) {
                current.add(part);
                continue;
            }
            if (first) {
                segment(current, level, true, sb);
                first = false;
            } else if (!current.isEmpty()) {
                lineStart(breaks, sb);
                breaks = 0;
                sb.append(indent(level + 1));
                segment(current, level + 1, false, sb);
            }
            current.clear();
            breaks += lineBreaks(part.element());
        }
        lineStart(breaks, sb);
        if (current.isEmpty()) {
            sb.append(indent(level));
        } else {
            sb.append(indent(level + 1));
            segment(current, level + 1, false, sb);
        }
        sb.append(close);
    }

    private void lineStart(int breaks, StringBuilder sb) {
        sb.append(nl);
        sb.append(nl.repeat(Math.min(Math.max(breaks - 1, 0), options.allowedBlankLines())));
    }

    /// Lays out the parts found on one line of a container.
    private void segment(List<Part> parts, int level, boolean afterOpen, StringBuilder sb) {
        Part previous = null;
        for (Part part : parts) {
            if (part.isItem()) {
                if (previous != null && (previous.isItem() || options.spaceAfterComma())) {
                    sb.append(' ');
                }
                if (part.kind() == SyntaxKind.ENTRY) {
                    entry((SyntaxNode) part.element(), level, sb);
                } else {
                    value((SyntaxNode) part.element(), level, sb);
                }
            } else if (part.kind() == SyntaxKind.COMMA) {
                sb.append(',');
            } else {
                if (previous != null || afterOpen) {
                    sb.append(" ".repeat(options.commentSpacing()));
                }
                sb.append(comment(part.element()));
            }
            previous = part;
        }
    }

    private static void removeTrailingComma(List<Part> parts) {
        final int last = parts.size() - 1;
        if (last > 0 && parts.get(last).kind() == SyntaxKind.COMMA && parts.get(last - 1).isItem()) {
            parts.remove(last);
        }
    }

    private static void addTrailingComma(List<Part> parts) {
        int lastItem = -1;
        for (int i = 0; i < parts.size(); i++) {
            if (parts.get(i).isItem()) {
                lastItem = i;
            }
        }
        if (lastItem < 0) {
            return;
        }
        for (int i = lastItem + 1; i < parts.size(); i++) {
            if (parts.get(i).kind() == SyntaxKind.COMMA) {
                return;
            }
        }
        parts.add(lastItem + 1, new Part(new SyntaxToken(SyntaxKind.COMMA, new Span(0, 1))));
    }
}
