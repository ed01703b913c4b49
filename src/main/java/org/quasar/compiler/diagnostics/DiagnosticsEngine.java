package org.quasar.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while a source is scanned, parsed and analyzed.
 * <p>
 * This decouples error reporting from the actual front-end logic (lexer, parser, analyzer).
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The code of the violated rule.
     * @param message The error message.
     * @param span    The source range of the error.
     */
    public void reportError(String code, String message, Span span) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, span));
    }

    /**
     * Reports a front-end error value.
     *
     * @param error The syntax or semantic error to record.
     */
    public void report(FrontendError error) {
        reportError(error.code(), error.message(), error.span());
    }

    /**
     * Reports a warning.
     *
     * @param code    The code of the rule.
     * @param message The warning message.
     * @param span    The source range of the warning.
     */
    public void reportWarning(String code, String message, Span span) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, span));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the first reported error, if any.
     *
     * @return The first error diagnostic.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
