package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A mutable binding {@code let name: type = initializer}.
 *
 * @param name The variable name.
 * @param type The declared annotation.
 * @param initializer The initial value.
 * @param span The source range from {@code let} to the end of the initializer.
 */
public record VarDecl(String name, TypeRef type, Expression initializer, Span span) implements Declaration {

    @Override
    public List<AstNode> getChildren() {
        return List.of(type, initializer);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVarDecl(this);
    }
}
