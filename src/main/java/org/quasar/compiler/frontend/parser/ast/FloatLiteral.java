package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * A floating-point literal such as {@code 3.14}.
 *
 * @param value The literal value.
 * @param span The source range of the literal.
 */
public record FloatLiteral(double value, Span span) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFloatLiteral(this);
    }
}
