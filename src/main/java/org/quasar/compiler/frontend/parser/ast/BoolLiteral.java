package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * A {@code true} or {@code false} literal.
 *
 * @param value The literal value.
 * @param span The source range of the literal.
 */
public record BoolLiteral(boolean value, Span span) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolLiteral(this);
    }
}
