package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A {@code name: value} field initializer inside a {@link StructInit}.
 *
 * @param name The field name.
 * @param value The initializer expression.
 * @param span The source range from the name to the end of the value.
 */
public record FieldInit(String name, Expression value, Span span) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
