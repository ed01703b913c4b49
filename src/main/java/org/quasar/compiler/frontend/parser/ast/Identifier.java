package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * A reference to a named binding, function, type or module.
 *
 * @param name The referenced name.
 * @param span The source range of the name.
 */
public record Identifier(String name, Span span) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
