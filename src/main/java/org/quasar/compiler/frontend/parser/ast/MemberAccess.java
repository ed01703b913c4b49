package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A field read such as {@code p.x}, an enum variant such as {@code Color.Red},
 * or a member of an imported module.
 *
 * @param object The expression left of the dot.
 * @param member The member name.
 * @param span The source range from the object to the member name.
 */
public record MemberAccess(Expression object, String member, Span span) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(object);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMemberAccess(this);
    }
}
