package toml.java21;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// A composite element of the syntax tree, e.g. an `ENTRY` or an `ARRAY`.
///
/// A node owns its children exclusively and its span is always the union of
/// the spans of its children: concatenating the text of all leaf tokens below
/// a node gives back exactly the source text of the node.
public record SyntaxNode(SyntaxKind kind, Span span, List<SyntaxElement> children) implements SyntaxElement {

    public SyntaxNode {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(children, "children must not be null");
        children = List.copyOf(children); // defensive copy
    }

    public Optional<SyntaxElement> firstChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /// @return the direct children that are nodes
    public List<SyntaxNode> childNodes() {
        final var nodes = new ArrayList<SyntaxNode>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /// @return the first direct child node of the given kind, if any
    public Optional<SyntaxNode> childNode(SyntaxKind kind) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node && node.kind() == kind) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /// All descendants in depth-first pre-order: a node comes before its
    /// children and children come in document order. Each call to
    /// `iterator()` starts a fresh traversal.
    public Iterable<SyntaxElement> descendants() {
        return () -> new DescendantIterator(this);
    }

    /// @return the descendants as a lazy sequential stream
    public Stream<SyntaxElement> descendantStream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new DescendantIterator(this), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /// @return the leaf tokens below this node in document order
    public List<SyntaxToken> tokens() {
        final var tokens = new ArrayList<SyntaxToken>();
        for (SyntaxElement element : descendants()) {
            if (element instanceof SyntaxToken token) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /// @return true if this node or any node below it has kind `ERROR`
    public boolean containsError() {
        return descendantStream().anyMatch(e -> e.kind() == SyntaxKind.ERROR);
    }

    private static final class DescendantIterator implements Iterator<SyntaxElement> {
        private final Deque<SyntaxElement> stack = new ArrayDeque<>();

        DescendantIterator(SyntaxNode node) {
            pushChildren(node);
        }

        private void pushChildren(SyntaxNode node) {
            final var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public SyntaxElement next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            final var element = stack.pop();
            if (element instanceof SyntaxNode node) {
                pushChildren(node);
            }
            return element;
        }
    }
}
