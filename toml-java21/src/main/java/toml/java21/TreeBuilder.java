package toml.java21;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// Stack based builder used by [TomlParser] to assemble a [SyntaxTree] bottom-up.
///
/// The cursor only ever advances by the length of each token pushed, so a
/// node closed by [#finishNode()] spans exactly the text of the tokens pushed
/// since its [#startNode(SyntaxKind)]. A builder serves one parse only.
/// Misuse is a bug in the caller and fails with `IllegalStateException`.
final class TreeBuilder {

    private record Frame(SyntaxKind kind, int start, List<SyntaxElement> children) {}

    private final Deque<Frame> stack = new ArrayDeque<>();
    private SyntaxNode root;
    private int cursor;

    void startNode(SyntaxKind kind) {
        if (root != null) {
            throw new IllegalStateException("startNode(" + kind + ") after the root node was closed");
        }
        stack.push(new Frame(kind, cursor, new ArrayList<>()));
    }

    void token(SyntaxKind kind, String text) {
        final var frame = stack.peek();
        if (frame == null) {
            throw new IllegalStateException("token(" + kind + ") without an open node");
        }
        frame.children().add(new SyntaxToken(kind, new Span(cursor, cursor + text.length())));
        cursor += text.length();
    }

    void finishNode() {
        final var frame = stack.poll();
        if (frame == null) {
            throw new IllegalStateException("finishNode() called without startNode()");
        }
        final var node = new SyntaxNode(frame.kind(), new Span(frame.start(), cursor), frame.children());
        final var parent = stack.peek();
        if (parent != null) {
            parent.children().add(node);
        } else {
            root = node;
        }
    }

    /// @return the current cursor, the offset of the next token to be pushed
    int cursor() {
        return cursor;
    }

    /// @return the kind of the innermost open node, or null once the root closed
    SyntaxKind currentKind() {
        final var frame = stack.peek();
        return frame == null ? null : frame.kind();
    }

    SyntaxTree finish(String source) {
        if (!stack.isEmpty()) {
            throw new IllegalStateException("TreeBuilder finished with " + stack.size() + " unclosed node(s), innermost " + stack.peek().kind());
        }
        if (root == null) {
            throw new IllegalStateException("TreeBuilder finished without a root node");
        }
        if (cursor != source.length()) {
            throw new IllegalStateException("TreeBuilder consumed " + cursor + " of " + source.length() + " chars");
        }
        return new SyntaxTree(root, source);
    }
}
