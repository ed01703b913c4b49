package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A list annotation {@code [T]}.
 *
 * @param element The element annotation.
 * @param span The source range from '[' to ']'.
 */
public record ListTypeRef(TypeRef element, Span span) implements TypeRef {

    @Override
    public List<AstNode> getChildren() {
        return List.of(element);
    }

    @Override
    public String display() {
        return "[" + element.display() + "]";
    }
}
