package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * An integer range {@code start..end}. The {@code ..} operator always excludes the end.
 *
 * @param start The first value.
 * @param end The bound.
 * @param exclusive Whether {@code end} itself is excluded.
 * @param span The union of both bound spans.
 */
public record RangeExpr(Expression start, Expression end, boolean exclusive, Span span) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(start, end);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRangeExpr(this);
    }
}
