package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A {@code return} statement.
 *
 * @param value The returned expression, or null for a bare {@code return}.
 * @param span The source range of the statement.
 */
public record ReturnStmt(Expression value, Span span) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturnStmt(this);
    }
}
