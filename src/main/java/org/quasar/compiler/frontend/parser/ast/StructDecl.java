package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A struct type declaration {@code struct Name { field: type, ... }}.
 *
 * @param name The struct name.
 * @param fields The fields in declaration order.
 * @param span The source range from {@code struct} to the closing brace.
 */
public record StructDecl(String name, List<FieldDecl> fields, Span span) implements Declaration {

    public StructDecl {
        fields = List.copyOf(fields);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(fields);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitStructDecl(this);
    }
}
