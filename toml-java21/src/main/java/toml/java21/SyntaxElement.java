package toml.java21;

/// An element of a syntax tree: either a composite [SyntaxNode] or a leaf [SyntaxToken].
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

    SyntaxKind kind();

    Span span();

    /// @return the source text covered by this element
    default String text(String source) {
        return span().text(source);
    }
}
