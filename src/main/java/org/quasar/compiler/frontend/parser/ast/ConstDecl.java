package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * An immutable binding {@code const name: type = initializer}.
 *
 * @param name The constant name.
 * @param type The declared annotation.
 * @param initializer The value.
 * @param span The source range from {@code const} to the end of the initializer.
 */
public record ConstDecl(String name, TypeRef type, Expression initializer, Span span) implements Declaration {

    @Override
    public List<AstNode> getChildren() {
        return List.of(type, initializer);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitConstDecl(this);
    }
}
