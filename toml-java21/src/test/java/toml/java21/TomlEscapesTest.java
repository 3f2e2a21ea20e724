package toml.java21;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TomlEscapesTest extends TomlTestBase {

    @ParameterizedTest
    @ValueSource(strings = {
            "plain text",
            "tab\\tnewline\\nquote\\\"backslash\\\\",
            "\\b\\f\\r",
            "caf\\u00E9",
            "smile \\U0001F600",
            "joined \\   \n   line",
            "joined \\\r\n line",
            ""
    })
    void testValidEscapes(String body) {
        assertThat(TomlEscapes.checkEscape(body)).isEmpty();
    }

    @Test
    void testReportsEveryInvalidEscape() {
        assertThat(TomlEscapes.checkEscape("x\\qy\\z")).containsExactly(1, 4);
    }

    @Test
    void testSurrogateCodePointIsInvalid() {
        assertThat(TomlEscapes.checkEscape("\\uD800")).containsExactly(0);
    }

    @Test
    void testCodePointBeyondUnicodeIsInvalid() {
        assertThat(TomlEscapes.checkEscape("ok \\U00110000")).containsExactly(3);
    }

    @Test
    void testShortUnicodeEscapeIsInvalid() {
        assertThat(TomlEscapes.checkEscape("\\u12")).containsExactly(0);
    }

    @Test
    void testTrailingLoneBackslash() {
        assertThat(TomlEscapes.checkEscape("abc\\")).containsExactly(3);
    }

    @Test
    void testBackslashSpaceWithoutNewlineIsInvalid() {
        assertThat(TomlEscapes.checkEscape("a\\ b")).containsExactly(1);
    }

    @Test
    void testClassify() {
        assertThat(TomlEscapes.classify("\\n", 0)).isEqualTo(TomlEscapes.Escape.SIMPLE);
        assertThat(TomlEscapes.classify("\\\n", 0)).isEqualTo(TomlEscapes.Escape.LINE_CONTINUATION);
        assertThat(TomlEscapes.classify("\\u0041", 0)).isEqualTo(TomlEscapes.Escape.UNICODE);
        assertThat(TomlEscapes.classify("\\U00000041", 0)).isEqualTo(TomlEscapes.Escape.UNICODE_LARGE);
        assertThat(TomlEscapes.classify("\\x", 0)).isEqualTo(TomlEscapes.Escape.UNKNOWN);
        assertThat(TomlEscapes.classify("x", 0)).isEqualTo(TomlEscapes.Escape.UNESCAPED);
    }
}
