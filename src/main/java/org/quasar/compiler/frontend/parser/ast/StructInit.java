package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A struct instantiation such as <code>Point { x: 1, y: 2 }</code>.
 *
 * @param name The struct name.
 * @param fields The field initializers in source order.
 * @param span The source range from the name to the closing brace.
 */
public record StructInit(String name, List<FieldInit> fields, Span span) implements Expression {

    public StructInit {
        fields = List.copyOf(fields);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(fields);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStructInit(this);
    }
}
