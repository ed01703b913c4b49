package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A function parameter {@code name: type}.
 *
 * @param name The parameter name.
 * @param type The parameter annotation.
 * @param span The source range from the name to the end of the annotation.
 */
public record Param(String name, TypeRef type, Span span) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(type);
    }
}
