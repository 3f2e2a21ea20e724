package toml.java21;

import net.jqwik.api.*;

import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Property based checks: losslessness and totality on arbitrary text,
/// idempotent formatting that keeps every significant token on generated
/// valid documents.
class TomlPropertyTest extends TomlTestBase {

    private static final Logger LOG = Logger.getLogger(TomlPropertyTest.class.getName());

    private static final List<String> KEYS = List.of(
            "a", "b-c", "key_1", "\"quoted key\"", "'literal key'", "x.y", "x . z", "1.2", "true", "2024-01-01", "dep*");

    private static final List<String> SCALARS = List.of(
            "1", "-17", "1_000", "0xDEAD_beef", "0o755", "0b101", "3.14", "6.626e-34", "inf", "-inf", "nan",
            "true", "false", "\"str\"", "\"esc \\t \\u00E9\"", "'lit'", "\"\"\"multi\nline\"\"\"", "'''raw\nlines'''",
            "1979-05-27", "07:32:00", "1979-05-27T07:32:00Z", "1979-05-27T00:32:00.999999-07:00");

    private static final int MAX_DEPTH = 2;

    // ========== Generators ==========

    @Provide
    Arbitrary<String> documents() {
        return line().list().ofMaxSize(12).map(lines -> String.join("\n", lines));
    }

    @Provide
    Arbitrary<String> tomlish() {
        return Arbitraries.strings()
                .withChars("abc19-_.=,[]{}\"'#\\ \t\n\rtrue:+eZ*")
                .withCharRange('\u0000', '\u0003')
                .ofMaxLength(60);
    }

    private Arbitrary<String> line() {
        return Arbitraries.oneOf(entry(), header(), comment(), Arbitraries.just(""));
    }

    private Arbitrary<String> whitespace() {
        return Arbitraries.of("", " ", "  ", "\t");
    }

    private Arbitrary<String> key() {
        return Arbitraries.of(KEYS);
    }

    private Arbitrary<String> comment() {
        return Arbitraries.of("# note", "#", "#  spaced out  ");
    }

    private Arbitrary<String> trailingComment() {
        return Arbitraries.of("", " # note", "\t#");
    }

    private Arbitrary<String> entry() {
        return Combinators.combine(whitespace(), key(), whitespace(), whitespace(), value(MAX_DEPTH), whitespace(), trailingComment())
                .as((indent, key, before, after, value, trailing, comment) ->
                        indent + key + before + "=" + after + value + trailing + comment);
    }

    private Arbitrary<String> header() {
        return Combinators.combine(whitespace(), key(), whitespace(), Arbitraries.of(true, false), trailingComment())
                .as((indent, key, pad, array, comment) -> array
                        ? indent + "[[" + pad + key + pad + "]]" + comment
                        : indent + "[" + pad + key + pad + "]" + comment);
    }

    private Arbitrary<String> value(int depth) {
        final Arbitrary<String> scalar = Arbitraries.of(SCALARS);
        if (depth == 0) {
            return scalar;
        }
        return Arbitraries.frequencyOf(
                Tuple.of(4, scalar),
                Tuple.of(1, Arbitraries.lazy(() -> array(depth - 1))),
                Tuple.of(1, Arbitraries.lazy(() -> inlineTable(depth - 1))));
    }

    private Arbitrary<String> array(int depth) {
        return Combinators.combine(
                        value(depth).list().ofMaxSize(4),
                        Arbitraries.of(", ", ",", " , ", ",\n  ", ",\n\n"),
                        Arbitraries.of("", " ", "\n"),
                        Arbitraries.of("", ","))
                .as((values, separator, pad, trailing) -> values.isEmpty()
                        ? "[" + pad + "]"
                        : "[" + pad + String.join(separator, values) + trailing + pad + "]");
    }

    private Arbitrary<String> inlineTable(int depth) {
        final Arbitrary<String> pair = Combinators.combine(key(), value(depth)).as((k, v) -> k + " = " + v);
        return pair.list().ofMaxSize(3).map(pairs -> pairs.isEmpty() ? "{}" : "{ " + String.join(", ", pairs) + " }");
    }

    // ========== Properties ==========

    @Property(tries = 300)
    void arbitraryTextIsParsedLosslessly(@ForAll("tomlish") String source) {
        final var result = Toml.parse(source);
        assertThat(result.tree().leafText()).isEqualTo(source);
        assertThat(result.tree().root().span()).isEqualTo(new Span(0, source.length()));
        if (result.tree().root().containsError()) {
            assertThat(result.diagnostics()).as("an ERROR node comes with a diagnostic").isNotEmpty();
        }
    }

    @Property(tries = 300)
    void formattingNeverFails(@ForAll("tomlish") String source) {
        final var formatted = Toml.format(source);
        assertThat(formatted).isNotNull();
    }

    @Property(tries = 300)
    void childSpansTileTheirParent(@ForAll("tomlish") String source) {
        final var root = Toml.parse(source).tree().root();
        for (SyntaxElement element : root.descendants()) {
            if (element instanceof SyntaxNode node && !node.children().isEmpty()) {
                int cursor = node.span().start();
                for (SyntaxElement child : node.children()) {
                    assertThat(child.span().start()).isEqualTo(cursor);
                    cursor = child.span().end();
                }
                assertThat(cursor).isEqualTo(node.span().end());
            }
        }
    }

    @Property(tries = 300)
    void generatedDocumentsAreValid(@ForAll("documents") String source) {
        final var result = Toml.parse(source);
        if (!result.isValid()) {
            LOG.severe(() -> "Unexpected diagnostics " + result.diagnostics() + " for:\n" + source);
        }
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.tree().leafText()).isEqualTo(source);
    }

    @Property(tries = 300)
    void formattingIsIdempotent(@ForAll("documents") String source) {
        final var once = Toml.format(source);
        final var twice = Toml.format(once);
        assertThat(twice).as("format(format(s)) for:\n%s", source).isEqualTo(once);
    }

    @Property(tries = 300)
    void formattingKeepsSignificantTokens(@ForAll("documents") String source) {
        final var formatted = Toml.format(source);
        final var after = Toml.parse(formatted);
        assertThat(after.diagnostics()).isEmpty();
        assertThat(significant(after)).isEqualTo(significant(Toml.parse(source)));
    }

    /// Token texts that formatting must not change: everything except
    /// whitespace, line breaks and commas. Comments may lose trailing blanks.
    private static List<String> significant(TomlParseResult result) {
        final var source = result.tree().source();
        return result.tree().root().tokens().stream()
                .filter(t -> t.kind() != SyntaxKind.WHITESPACE && t.kind() != SyntaxKind.NEWLINE && t.kind() != SyntaxKind.COMMA)
                .map(t -> t.kind() + ":" + t.text(source).stripTrailing())
                .toList();
    }
}
