package toml.java21;

import java.util.Objects;

/// A finished, immutable syntax tree together with the source it spans.
///
/// Every span in the tree indexes into `source`.
public record SyntaxTree(SyntaxNode root, String source) {

    public SyntaxTree {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    /// Rebuilds the source by concatenating the text of every leaf token in
    /// document order. Always equal to `source()`.
    public String leafText() {
        final var sb = new StringBuilder(source.length());
        for (SyntaxToken token : root.tokens()) {
            sb.append(source, token.span().start(), token.span().end());
        }
        return sb.toString();
    }

    /// @return an indented dump of the tree, one element per line
    public String debugString() {
        final var sb = new StringBuilder();
        dump(root, 0, sb);
        return sb.toString();
    }

    private void dump(SyntaxElement element, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(element.kind()).append('@').append(element.span());
        if (element instanceof SyntaxToken token) {
            sb.append(' ').append(quote(token.text(source)));
        }
        sb.append('\n');
        if (element instanceof SyntaxNode node) {
            for (SyntaxElement child : node.children()) {
                dump(child, depth + 1, sb);
            }
        }
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t") + '"';
    }
}
