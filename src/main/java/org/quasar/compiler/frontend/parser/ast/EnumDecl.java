package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * An enum type declaration {@code enum Name { A, B }}.
 *
 * @param name The enum name.
 * @param variants The variants in declaration order, at least one.
 * @param span The source range from {@code enum} to the closing brace.
 */
public record EnumDecl(String name, List<EnumVariant> variants, Span span) implements Declaration {

    public EnumDecl {
        variants = List.copyOf(variants);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(variants);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitEnumDecl(this);
    }
}
