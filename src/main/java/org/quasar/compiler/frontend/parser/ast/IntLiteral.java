package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * An integer literal such as {@code 42}.
 *
 * @param value The literal value.
 * @param span The source range of the literal.
 */
public record IntLiteral(long value, Span span) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIntLiteral(this);
    }
}
