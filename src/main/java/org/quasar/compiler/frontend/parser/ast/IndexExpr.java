package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A list or dictionary subscript such as {@code xs[0]} or {@code ages["bob"]}.
 *
 * @param target The indexed expression.
 * @param index The index or key expression.
 * @param span The source range from the target to the closing bracket.
 */
public record IndexExpr(Expression target, Expression index, Span span) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, index);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIndexExpr(this);
    }
}
