package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * An expression evaluated for its side effects, typically a call.
 *
 * @param expression The expression.
 * @param span The span of the expression.
 */
public record ExpressionStmt(Expression expression, Span span) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpressionStmt(this);
    }
}
