package toml.java21;

import java.util.Objects;

/// Entry point for parsing and formatting TOML documents.
///
/// Parsing is lossless and total: every input, valid or not, produces a
/// [SyntaxTree] whose tokens concatenate back to the input, together with
/// the [Diagnostic]s found on the way.
///
/// ```java
/// TomlParseResult result = Toml.parse("title = \"TOML\"\n");
/// if (result.isValid()) {
///     System.out.println(result.tree().debugString());
/// }
/// String pretty = Toml.format("a=1\n[b]\nc=[1,2,]");
/// ```
///
/// All methods are stateless and may be called concurrently.
public final class Toml {

    private Toml() {}

    /// Parses a document with [ParseOptions#defaults()].
    public static TomlParseResult parse(String source) {
        return parse(source, ParseOptions.defaults());
    }

    public static TomlParseResult parse(String source, ParseOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return TomlParser.parse(source, options);
    }

    /// Formats a document with [TomlFormatOptions#defaults()].
    public static String format(String source) {
        return format(source, TomlFormatOptions.defaults());
    }

    /// Formats a document. Lines with syntax errors are kept as written.
    /// @param source the document. Non-null.
    /// @param options layout options. Non-null.
    /// @return the formatted document
    public static String format(String source, TomlFormatOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return TomlFormatter.format(source, options);
    }
}
