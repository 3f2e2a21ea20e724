package toml.java21.compatibility;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Stream;

/// Access to a local checkout of the `toml-test` corpus
/// (https://github.com/toml-lang/toml-test).
///
/// The location of the `tests` directory is read from the `toml.test.dir`
/// system property. Files under `valid/` must parse without diagnostics and
/// files under `invalid/` must produce at least one, except for the ones in
/// [#SKIP_INVALID].
public final class TomlTestCorpus {

    private static final Logger LOGGER = Logger.getLogger(TomlTestCorpus.class.getName());

    public static final String DIR_PROPERTY = "toml.test.dir";

    /// Invalid documents that are only rejected by semantic checks this
    /// parser does not make (duplicate keys, table redefinition, dotted key
    /// conflicts), or that became valid in TOML 1.1.
    public static final Set<String> SKIP_INVALID = Set.of(
            "array/extend-defined-aot.toml",
            "array/extending-table.toml",
            "array/tables-01.toml",
            "array/tables-02.toml",
            "control/multi-cr.toml",
            "control/rawmulti-cr.toml",
            "inline-table/duplicate-key-01.toml",
            "inline-table/duplicate-key-02.toml",
            "inline-table/duplicate-key-03.toml",
            "inline-table/duplicate-key-04.toml",
            "inline-table/overwrite-01.toml",
            "inline-table/overwrite-02.toml",
            "inline-table/overwrite-03.toml",
            "inline-table/overwrite-04.toml",
            "inline-table/overwrite-05.toml",
            "inline-table/overwrite-06.toml",
            "inline-table/overwrite-07.toml",
            "inline-table/overwrite-08.toml",
            "inline-table/overwrite-09.toml",
            "inline-table/overwrite-10.toml",
            // accepted by TOML 1.1
            "inline-table/empty-03.toml",
            "inline-table/linebreak-01.toml",
            "inline-table/linebreak-02.toml",
            "inline-table/linebreak-03.toml",
            "inline-table/linebreak-04.toml",
            "inline-table/trailing-comma.toml",
            "key/dotted-redefine-table-01.toml",
            "key/dotted-redefine-table-02.toml",
            "key/duplicate-keys-01.toml",
            "key/duplicate-keys-02.toml",
            "key/duplicate-keys-03.toml",
            "key/duplicate-keys-04.toml",
            "key/duplicate-keys-05.toml",
            "key/duplicate-keys-06.toml",
            "key/duplicate-keys-07.toml",
            "key/duplicate-keys-08.toml",
            "key/duplicate-keys-09.toml",
            "spec-1.0.0/inline-table-2-0.toml",
            "spec-1.0.0/inline-table-3-0.toml",
            "spec-1.0.0/table-9-0.toml",
            "spec-1.0.0/table-9-1.toml",
            "spec-1.1.0/common-46-0.toml",
            "spec-1.1.0/common-46-1.toml",
            "spec-1.1.0/common-49-0.toml",
            "spec-1.1.0/common-50-0.toml",
            "table/append-with-dotted-keys-01.toml",
            "table/append-with-dotted-keys-02.toml",
            "table/append-with-dotted-keys-03.toml",
            "table/append-with-dotted-keys-04.toml",
            "table/append-with-dotted-keys-05.toml",
            "table/append-with-dotted-keys-06.toml",
            "table/append-with-dotted-keys-07.toml",
            "table/array-implicit.toml",
            "table/duplicate-key-01.toml",
            "table/duplicate-key-02.toml",
            "table/duplicate-key-03.toml",
            "table/duplicate-key-04.toml",
            "table/duplicate-key-05.toml",
            "table/duplicate-key-06.toml",
            "table/duplicate-key-07.toml",
            "table/duplicate-key-08.toml",
            "table/duplicate-key-09.toml",
            "table/duplicate-key-10.toml",
            "table/overwrite-array-in-parent.toml",
            "table/overwrite-bool-with-array.toml",
            "table/overwrite-with-deep-table.toml",
            "table/redefine-01.toml",
            "table/redefine-02.toml",
            "table/redefine-03.toml",
            "table/super-twice.toml");

    private TomlTestCorpus() {}

    /// @return the corpus `tests` directory, if the property names an existing directory
    public static Optional<Path> locate() {
        final String dir = System.getProperty(DIR_PROPERTY);
        // an unset Maven property is passed through literally
        if (dir == null || dir.isBlank() || dir.startsWith("${")) {
            return Optional.empty();
        }
        final Path path = Path.of(dir);
        return Files.isDirectory(path) ? Optional.of(path) : Optional.empty();
    }

    /// @return the `.toml` files below `root/category` in a stable order
    public static List<Path> files(Path root, String category) throws IOException {
        final Path dir = root.resolve(category);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(p -> p.toString().endsWith(".toml")).sorted().toList();
        }
    }

    /// @return the path of `file` relative to `root/category`, with `/` separators
    public static String relativeName(Path root, String category, Path file) {
        return root.resolve(category).relativize(file).toString().replace('\\', '/');
    }

    public static boolean skipInvalid(String relativeName) {
        return SKIP_INVALID.contains(relativeName);
    }

    /// Reads a corpus document. Documents that are not UTF-8 are not TOML at all.
    /// @return the text, or empty if the file is not valid UTF-8
    public static Optional<String> read(Path file) throws IOException {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (MalformedInputException e) {
            LOGGER.fine(() -> "Skipping non UTF-8 file " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
