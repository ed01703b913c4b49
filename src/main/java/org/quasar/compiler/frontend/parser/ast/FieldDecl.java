package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A struct field declaration {@code name: type}.
 *
 * @param name The field name.
 * @param type The field annotation.
 * @param span The source range from the name to the end of the annotation.
 */
public record FieldDecl(String name, TypeRef type, Span span) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(type);
    }
}
