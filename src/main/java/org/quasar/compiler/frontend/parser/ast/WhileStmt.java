package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A {@code while} loop.
 *
 * @param condition The loop condition, which must be {@code bool}.
 * @param body The loop body.
 * @param span The source range from {@code while} to the end of the body.
 */
public record WhileStmt(Expression condition, Block body, Span span) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhileStmt(this);
    }
}
