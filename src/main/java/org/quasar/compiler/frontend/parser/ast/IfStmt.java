package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A conditional. An {@code else if} chain is represented as an else block holding a single nested {@code IfStmt}.
 *
 * @param condition The condition, which must be {@code bool}.
 * @param thenBlock The block executed when the condition holds.
 * @param elseBlock The else block, or null if there is none.
 * @param span The source range from {@code if} to the end of the last block.
 */
public record IfStmt(Expression condition, Block thenBlock, Block elseBlock, Span span) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBlock);
        if (elseBlock != null) {
            children.add(elseBlock);
        }
        return children;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIfStmt(this);
    }
}
