package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A dictionary literal such as <code>{"a": 1, "b": 2}</code>. Entry order is preserved.
 *
 * @param entries The entries in source order.
 * @param span The source range from '{' to '}'.
 */
public record DictLiteral(List<DictEntry> entries, Span span) implements Expression {

    public DictLiteral {
        entries = List.copyOf(entries);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(entries);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDictLiteral(this);
    }
}
