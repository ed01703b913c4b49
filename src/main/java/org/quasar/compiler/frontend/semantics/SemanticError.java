package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.api.CompilerErrorCode;
import org.quasar.compiler.diagnostics.FrontendError;
import org.quasar.compiler.diagnostics.Span;

/**
 * The diagnostic produced when a parsed program violates a scope, type or control-flow rule.
 * Displayed as {@code <source>:<line>:<col>: <code>: <message>}.
 *
 * @param errorCode The violated rule.
 * @param message The human-readable message.
 * @param span The span of the offending construct.
 */
public record SemanticError(CompilerErrorCode errorCode, String message, Span span) implements FrontendError {

    @Override
    public String code() {
        return errorCode.code();
    }

    @Override
    public String toString() {
        return display();
    }
}
