package toml.java21;

import java.util.Objects;

/// A recoverable problem found while parsing, with the span of source it concerns.
public record Diagnostic(Span span, String message) {

    public Diagnostic {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /// @return the char offset where the problem starts
    public int offset() {
        return span.start();
    }

    @Override
    public String toString() {
        return message + " at " + span;
    }
}
