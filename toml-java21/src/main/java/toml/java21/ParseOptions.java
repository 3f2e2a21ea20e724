package toml.java21;

/// Options for [Toml#parse(String, ParseOptions)].
///
/// @param globKeys accept identifiers containing `*` and `?` (such as
///        `dependencies.serde*`) as key segments. These are not TOML but are
///        used by tools that match keys against patterns. When false they are
///        reported as invalid keys. Defaults to true.
public record ParseOptions(boolean globKeys) {

    private static final ParseOptions DEFAULTS = new ParseOptions(true);

    public static ParseOptions defaults() {
        return DEFAULTS;
    }

    /// Options that only accept keys allowed by the TOML specification.
    public static ParseOptions strict() {
        return new ParseOptions(false);
    }
}
