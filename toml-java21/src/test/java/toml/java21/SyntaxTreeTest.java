package toml.java21;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static toml.java21.SyntaxKind.*;

/// Tree model: spans, traversal and accessors.
class SyntaxTreeTest extends TomlTestBase {

    @Test
    void testSpanValidation() {
        assertThatThrownBy(() -> new Span(2, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Span(-1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Span(3, 3).isEmpty()).isTrue();
        assertThat(new Span(1, 4).length()).isEqualTo(3);
        assertThat(new Span(1, 4).toString()).isEqualTo("1..4");
    }

    @Test
    void testSpanContainment() {
        final var span = new Span(2, 6);
        assertThat(span.contains(2)).isTrue();
        assertThat(span.contains(6)).isFalse();
        assertThat(span.contains(new Span(3, 6))).isTrue();
        assertThat(span.contains(new Span(1, 3))).isFalse();
    }

    @Test
    void testSpanOverlap() {
        assertThat(new Span(0, 4).overlaps(new Span(2, 6))).isTrue();
        assertThat(new Span(2, 3).overlaps(new Span(0, 10))).isTrue();
        assertThat(new Span(0, 2).overlaps(new Span(2, 4))).isTrue();
        assertThat(new Span(0, 1).overlaps(new Span(2, 3))).isFalse();
    }

    @Test
    void testDescendantsArePreOrder() {
        final var tree = Toml.parse("a = [1]").tree();
        final var kinds = new ArrayList<SyntaxKind>();
        for (SyntaxElement element : tree.root().descendants()) {
            kinds.add(element.kind());
        }
        assertThat(kinds).containsExactly(
                ENTRY, KEY, IDENT, WHITESPACE, EQ, WHITESPACE,
                VALUE, ARRAY, BRACKET_START, VALUE, INTEGER, BRACKET_END);
        assertThat(tree.root().descendantStream().map(SyntaxElement::kind).toList()).isEqualTo(kinds);
    }

    @Test
    void testDescendantsCanBeIteratedTwice() {
        final var root = Toml.parse("a = 1\nb = 2\n").tree().root();
        final var iterable = root.descendants();
        int first = 0;
        for (SyntaxElement ignored : iterable) {
            first++;
        }
        int second = 0;
        for (SyntaxElement ignored : iterable) {
            second++;
        }
        assertThat(first).isEqualTo(second).isGreaterThan(0);
    }

    @Test
    void testElementText() {
        final var tree = Toml.parse("title = \"TOML\"\n").tree();
        final var entry = tree.root().childNode(ENTRY).orElseThrow();
        assertThat(entry.text(tree.source())).isEqualTo("title = \"TOML\"");
        assertThat(entry.childNode(KEY).orElseThrow().text(tree.source())).isEqualTo("title");
        assertThat(entry.childNode(VALUE).orElseThrow().text(tree.source())).isEqualTo("\"TOML\"");
        assertThat(tree.root().firstChild()).containsSame(entry);
    }

    @Test
    void testTokensAndChildNodes() {
        final var root = Toml.parse("[t]\nx = 1\n").tree().root();
        assertThat(root.childNodes()).extracting(SyntaxNode::kind).containsExactly(TABLE_HEADER, ENTRY);
        assertThat(root.tokens()).extracting(SyntaxToken::kind)
                .containsExactly(BRACKET_START, IDENT, BRACKET_END, NEWLINE, IDENT, WHITESPACE, EQ, WHITESPACE, INTEGER, NEWLINE);
        assertThat(root.containsError()).isFalse();
    }

    @Test
    void testChildrenAreImmutable() {
        final var root = Toml.parse("a = 1").tree().root();
        assertThatThrownBy(() -> root.children().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testDebugString() {
        final var tree = Toml.parse("a = 1\n").tree();
        final var dump = tree.debugString();
        assertThat(dump).startsWith("ROOT@0..6\n");
        assertThat(dump).contains("  ENTRY@0..5\n");
        assertThat(dump).contains("      INTEGER@4..5 \"1\"");
        assertThat(dump).contains("  NEWLINE@5..6 \"\\n\"");
    }

    @Test
    void testComposite() {
        assertThat(IDENT.isComposite()).isFalse();
        assertThat(ERROR.isComposite()).isFalse();
        assertThat(KEY.isComposite()).isTrue();
        assertThat(ROOT.isComposite()).isTrue();
        assertThat(COMMENT.isTrivia()).isTrue();
        assertThat(TIME.isScalarValue()).isTrue();
        assertThat(IDENT.isScalarValue()).isFalse();
    }
}
