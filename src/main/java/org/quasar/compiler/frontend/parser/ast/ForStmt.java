package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A {@code for variable in iterable} loop over a range or a list.
 *
 * @param variable The loop variable name.
 * @param iterable The iterated expression.
 * @param body The loop body.
 * @param span The source range from {@code for} to the end of the body.
 */
public record ForStmt(String variable, Expression iterable, Block body, Span span) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(iterable, body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForStmt(this);
    }
}
