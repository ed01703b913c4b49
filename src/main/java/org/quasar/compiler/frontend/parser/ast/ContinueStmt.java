package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * A {@code continue} statement.
 *
 * @param span The span of the keyword.
 */
public record ContinueStmt(Span span) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitContinueStmt(this);
    }
}
