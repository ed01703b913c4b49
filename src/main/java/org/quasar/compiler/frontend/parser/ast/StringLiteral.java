package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * A string literal. The value excludes the surrounding quotes.
 *
 * @param value The literal value.
 * @param span The source range of the literal.
 */
public record StringLiteral(String value, Span span) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
