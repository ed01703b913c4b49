package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A list literal such as {@code [1, 2, 3]}.
 *
 * @param elements The element expressions in source order.
 * @param span The source range from '[' to ']'.
 */
public record ListLiteral(List<Expression> elements, Span span) implements Expression {

    public ListLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(elements);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitListLiteral(this);
    }
}
