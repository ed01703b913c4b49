package org.quasar.compiler.frontend.parser;

import org.quasar.compiler.diagnostics.FrontendError;
import org.quasar.compiler.diagnostics.Span;

/**
 * The diagnostic produced when the token stream does not match the grammar.
 * Displayed as {@code <source>:<line>:<col>: syntax error: <message>}.
 *
 * @param message Names the construct that was expected.
 * @param span The span of the offending token.
 */
public record SyntaxError(String message, Span span) implements FrontendError {

    /** The family name used in place of a rule code. */
    public static final String CODE = "syntax error";

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public String toString() {
        return display();
    }
}
