package toml.java21;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Parses and formats the documents under `fixtures/` and checks that an
/// independent TOML reader sees the same data before and after formatting.
class TomlFixturesTest extends TomlTestBase {

    private static final Logger LOG = Logger.getLogger(TomlFixturesTest.class.getName());
    private static final TomlMapper MAPPER = new TomlMapper();

    private static String fixture(String name) throws IOException {
        final var base = Path.of(System.getProperty("toml.test.resources"), "fixtures");
        return Files.readString(base.resolve(name), StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.toml", "strings.toml", "numbers.toml", "arrays.toml", "keys.toml"})
    void testFixtureIsValidAndLossless(String name) throws IOException {
        final var source = fixture(name);
        final var result = parseLossless(source);
        assertThat(result.diagnostics()).as("diagnostics in %s", name).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.toml", "strings.toml", "numbers.toml", "arrays.toml", "keys.toml"})
    void testFormattingIsIdempotentAndValid(String name) throws IOException {
        final var formatted = Toml.format(fixture(name));
        LOG.fine(() -> "Formatted " + name + ":\n" + formatted);
        assertThat(Toml.parse(formatted).diagnostics()).isEmpty();
        assertThat(Toml.format(formatted)).isEqualTo(formatted);
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.toml", "strings.toml", "numbers.toml", "arrays.toml", "keys.toml"})
    void testFormattingPreservesData(String name) throws IOException {
        final var source = fixture(name);
        final JsonNode before;
        try {
            before = MAPPER.readTree(source);
        } catch (IOException e) {
            LOG.warning(() -> "Reference reader rejected " + name + ", skipping data comparison: " + e.getMessage());
            return;
        }
        final JsonNode after = MAPPER.readTree(Toml.format(source));
        assertThat(after).as("data of formatted %s", name).isEqualTo(before);
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.toml", "arrays.toml"})
    void testFormattingWithAllOptionsChangedPreservesData(String name) throws IOException {
        final var options = TomlFormatOptions.defaults()
                .withSpacesAroundEquals(false)
                .withSpaceAfterComma(false)
                .withCompactArrays(false)
                .withCompactInlineTables(true)
                .withIndentEntries(true)
                .withIndentString("\t")
                .withAllowedBlankLines(0)
                .withCrlf(true)
                .withCommentSpacing(3);
        final var source = fixture(name);
        final var formatted = Toml.format(source, options);
        assertThat(Toml.parse(formatted).diagnostics()).isEmpty();
        assertThat(Toml.format(formatted, options)).isEqualTo(formatted);
        assertThat(MAPPER.readTree(formatted)).isEqualTo(MAPPER.readTree(source));
    }
}
