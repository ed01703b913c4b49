package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * An assignment to a list element or dictionary entry, {@code xs[i] = value}.
 *
 * @param target The subscript being written.
 * @param value The assigned expression.
 * @param span The source range from the target to the end of the value.
 */
public record IndexAssignStmt(IndexExpr target, Expression value, Span span) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIndexAssignStmt(this);
    }
}
