package toml.java21;

import java.util.List;
import java.util.Objects;

/// Outcome of [Toml#parse(String)]: a tree that always covers the whole
/// source, plus the diagnostics collected on the way in source order.
///
/// Empty diagnostics mean the source is syntactically valid TOML. Semantic
/// rules such as duplicate keys or table redefinition are not checked.
public record TomlParseResult(SyntaxTree tree, List<Diagnostic> diagnostics) {

    public TomlParseResult {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        diagnostics = List.copyOf(diagnostics); // defensive copy
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }

    /// @return this result if it has no diagnostics
    /// @throws TomlParseException describing the first diagnostic otherwise
    public TomlParseResult requireValid() {
        if (!diagnostics.isEmpty()) {
            final var first = diagnostics.get(0);
            throw new TomlParseException(first.message(), tree.source(), first.offset(), diagnostics.size());
        }
        return this;
    }
}
