package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * One {@code key: value} pair of a {@link DictLiteral}.
 *
 * @param key The key expression.
 * @param value The value expression.
 */
public record DictEntry(Expression key, Expression value) implements AstNode {

    @Override
    public Span span() {
        return Span.merge(key.span(), value.span());
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(key, value);
    }
}
