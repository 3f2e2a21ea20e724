package toml.java21;

import java.util.Optional;

/// Syntax checks for number tokens.
///
/// The lexer accepts any run of digits and underscores so that a malformed
/// number still becomes a single token. These checks reject what TOML does
/// not allow: underscores that are not between two digits and leading zeros
/// in decimal integers and in the integer part of floats.
final class TomlNumbers {

    private TomlNumbers() {}

    /// @return a diagnostic message, or empty if `text` is a valid number of `kind`
    static Optional<String> check(SyntaxKind kind, String text) {
        return switch (kind) {
            case INTEGER -> decimalInteger(unsigned(text), "integer");
            case INTEGER_HEX, INTEGER_OCT, INTEGER_BIN -> digitGroups(text.substring(2), "integer");
            case FLOAT -> floatingPoint(text);
            default -> Optional.empty();
        };
    }

    private static Optional<String> floatingPoint(String text) {
        final var body = unsigned(text);
        if (body.equals("nan") || body.equals("inf")) {
            return Optional.empty();
        }
        int exponent = body.indexOf('e');
        if (exponent < 0) {
            exponent = body.indexOf('E');
        }
        final var mantissa = exponent < 0 ? body : body.substring(0, exponent);
        final int period = mantissa.indexOf('.');
        final var integral = period < 0 ? mantissa : mantissa.substring(0, period);

        var problem = decimalInteger(integral, "float");
        if (problem.isEmpty() && period >= 0) {
            problem = digitGroups(mantissa.substring(period + 1), "float fraction");
        }
        if (problem.isEmpty() && exponent >= 0) {
            problem = digitGroups(unsigned(body.substring(exponent + 1)), "float exponent");
        }
        return problem;
    }

    private static Optional<String> decimalInteger(String digits, String what) {
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            return Optional.of("leading zeros are not allowed in " + what);
        }
        return digitGroups(digits, what);
    }

    private static Optional<String> digitGroups(String digits, String what) {
        if (digits.isEmpty()) {
            return Optional.of("missing digits in " + what);
        }
        if (digits.startsWith("_") || digits.endsWith("_") || digits.contains("__")) {
            return Optional.of("underscores in " + what + " must be surrounded by digits");
        }
        return Optional.empty();
    }

    private static String unsigned(String text) {
        return !text.isEmpty() && (text.charAt(0) == '+' || text.charAt(0) == '-') ? text.substring(1) : text;
    }
}
