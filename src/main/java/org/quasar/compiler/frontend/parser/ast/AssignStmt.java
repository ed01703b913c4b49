package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * An assignment to a plain variable, {@code x = value}.
 *
 * @param target The assigned variable name.
 * @param targetSpan The span of the variable name.
 * @param value The assigned expression.
 * @param span The source range from the target to the end of the value.
 */
public record AssignStmt(String target, Span targetSpan, Expression value, Span span) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssignStmt(this);
    }
}
