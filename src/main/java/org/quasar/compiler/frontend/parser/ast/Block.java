package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A braced sequence of statements and declarations. Each block opens its own scope,
 * except a function body, whose top level shares the scope of the parameters.
 *
 * @param statements The contained items in source order.
 * @param span The source range from '{' to '}'.
 */
public record Block(List<Statement> statements, Span span) implements Statement {

    public Block {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
