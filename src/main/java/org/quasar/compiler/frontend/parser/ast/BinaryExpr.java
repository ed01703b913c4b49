package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A binary operation such as {@code a + b}.
 *
 * @param left The left operand.
 * @param operator The operator.
 * @param right The right operand.
 * @param span The union of both operand spans.
 */
public record BinaryExpr(Expression left, BinaryOperator operator, Expression right, Span span) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryExpr(this);
    }
}
