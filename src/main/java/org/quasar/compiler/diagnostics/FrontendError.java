package org.quasar.compiler.diagnostics;

/**
 * The single diagnostic a front-end stage hands back when it rejects its input.
 * Implemented by the immutable {@code SyntaxError} and {@code SemanticError} records.
 */
public interface FrontendError {

    /**
     * @return The stable rule code, or the family name for syntax errors.
     */
    String code();

    /**
     * @return The human-readable message.
     */
    String message();

    /**
     * @return The source range of the offending construct.
     */
    Span span();

    /**
     * @return The display form {@code <source>:<line>:<col>: <code>: <message>}.
     */
    default String display() {
        return span() + ": " + code() + ": " + message();
    }
}
