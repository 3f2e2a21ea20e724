package toml.java21;

import java.util.Objects;

/// A leaf of the syntax tree, e.g. an `IDENT`, a `STRING` or a `COMMA`.
public record SyntaxToken(SyntaxKind kind, Span span) implements SyntaxElement {

    public SyntaxToken {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }
}
