package org.quasar.compiler.api;

import org.quasar.compiler.diagnostics.FrontendError;

import java.util.Optional;

/**
 * An exception that is thrown when the source fails lexing, parsing or semantic analysis.
 * <p>
 * It is part of the public API and hides the internal result types of the front end.
 */
public class CompilationException extends Exception {

    private final transient FrontendError error;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message);
        this.error = null;
    }

    /**
     * Constructs a new compilation exception from a front-end diagnostic. The message is the
     * diagnostic's display form, e.g. {@code main.qsr:3:5: E0100: type mismatch ...}.
     * @param error The syntax or semantic error.
     */
    public CompilationException(FrontendError error) {
        super(error.display());
        this.error = error;
    }

    /**
     * @return The syntax or semantic error, empty for lexical failures.
     */
    public Optional<FrontendError> getError() {
        return Optional.ofNullable(error);
    }
}
