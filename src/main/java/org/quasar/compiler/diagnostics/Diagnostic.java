package org.quasar.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while the front end processes a source.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The stable code of the violated rule, or the diagnostic family for syntax and lexical errors.
 * @param message The diagnostic message.
 * @param span The source range the diagnostic points at.
 */
public record Diagnostic(
        Type type,
        String code,
        String message,
        Span span
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * @return The diagnostic in the form {@code source:line:col: code: message}.
     */
    public String display() {
        return span + ": " + code + ": " + message;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s: %s", type, span, code, message);
    }
}
