package toml.java21.compatibility;

import toml.java21.Toml;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Generates a conformance summary report against the `toml-test` corpus.
/// Run the main class with `-Dtoml.test.dir=/path/to/toml-test/tests`.
public class TomlTestSuiteSummary {

    private static final Logger LOGGER = Logger.getLogger(TomlTestSuiteSummary.class.getName());

    public static void main(String[] args) throws Exception {
        final Path root = TomlTestCorpus.locate()
                .orElseThrow(() -> new IllegalStateException(
                        "toml-test corpus not found. Pass -D" + TomlTestCorpus.DIR_PROPERTY + "=/path/to/toml-test/tests"));
        new TomlTestSuiteSummary().generateConformanceReport(root);
    }

    void generateConformanceReport(Path root) throws Exception {
        final TestResults results = runTests(root);

        System.out.println("\n=== toml-test Conformance Report ===");
        System.out.printf("Corpus: %s%n", root);
        System.out.printf("Files skipped (not UTF-8 or semantic only): %d%n%n", results.skipped());

        System.out.println("Valid TOML:");
        System.out.printf("  Parsed without diagnostics: %d%n", results.validPass());
        System.out.printf("  Rejected: %d%n", results.validFail());
        System.out.printf("  Formatting not idempotent: %d%n%n", results.notIdempotent().size());

        System.out.println("Invalid TOML:");
        System.out.printf("  Correctly rejected: %d%n", results.invalidPass());
        System.out.printf("  Incorrectly accepted: %d%n%n", results.invalidFail());

        final int total = results.validPass() + results.validFail() + results.invalidPass() + results.invalidFail();
        if (total > 0) {
            System.out.printf("Overall Conformance: %.1f%%%n",
                    100.0 * (results.validPass() + results.invalidPass()) / total);
        }

        if (!results.shouldPassButFailed().isEmpty()) {
            System.out.println("\nValid TOML that was rejected:");
            results.shouldPassButFailed().forEach(f -> System.out.println("  - " + f));
        }
        if (!results.shouldFailButPassed().isEmpty()) {
            System.out.println("\nInvalid TOML that was accepted:");
            results.shouldFailButPassed().forEach(f -> System.out.println("  - " + f));
        }
        if (!results.notIdempotent().isEmpty()) {
            System.out.println("\nFormatting not idempotent:");
            results.notIdempotent().forEach(f -> System.out.println("  - " + f));
        }
    }

    private TestResults runTests(Path root) throws Exception {
        final List<String> shouldPassButFailed = new ArrayList<>();
        final List<String> shouldFailButPassed = new ArrayList<>();
        final List<String> notIdempotent = new ArrayList<>();
        int skipped = 0;
        int validPass = 0, validFail = 0;
        int invalidPass = 0, invalidFail = 0;

        for (Path file : TomlTestCorpus.files(root, "valid")) {
            final String name = TomlTestCorpus.relativeName(root, "valid", file);
            final var source = TomlTestCorpus.read(file);
            if (source.isEmpty()) {
                skipped++;
                continue;
            }
            if (Toml.parse(source.get()).isValid()) {
                validPass++;
            } else {
                validFail++;
                shouldPassButFailed.add(name);
            }
            final String once = Toml.format(source.get());
            if (!once.equals(Toml.format(once))) {
                notIdempotent.add(name);
            }
        }

        for (Path file : TomlTestCorpus.files(root, "invalid")) {
            final String name = TomlTestCorpus.relativeName(root, "invalid", file);
            if (TomlTestCorpus.skipInvalid(name)) {
                skipped++;
                continue;
            }
            final var source = TomlTestCorpus.read(file);
            if (source.isEmpty()) {
                skipped++;
                continue;
            }
            if (Toml.parse(source.get()).isValid()) {
                invalidFail++;
                shouldFailButPassed.add(name);
            } else {
                invalidPass++;
            }
        }

        LOGGER.fine(() -> "Checked " + shouldPassButFailed.size() + " rejected valid and "
                + shouldFailButPassed.size() + " accepted invalid documents");
        return new TestResults(skipped, validPass, validFail, invalidPass, invalidFail,
                shouldPassButFailed, shouldFailButPassed, notIdempotent);
    }

    private record TestResults(
            int skipped,
            int validPass, int validFail, int invalidPass, int invalidFail,
            List<String> shouldPassButFailed, List<String> shouldFailButPassed, List<String> notIdempotent
    ) {}
}
