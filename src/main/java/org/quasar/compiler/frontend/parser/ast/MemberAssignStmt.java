package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * An assignment to a struct field, {@code p.x = value}.
 *
 * @param target The field being written.
 * @param value The assigned expression.
 * @param span The source range from the target to the end of the value.
 */
public record MemberAssignStmt(MemberAccess target, Expression value, Span span) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitMemberAssignStmt(this);
    }
}
