package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A prefix operation such as {@code -x} or {@code !done}.
 *
 * @param operator The operator.
 * @param operand The operand.
 * @param span The source range from the operator to the end of the operand.
 */
public record UnaryExpr(UnaryOperator operator, Expression operand, Span span) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnaryExpr(this);
    }
}
