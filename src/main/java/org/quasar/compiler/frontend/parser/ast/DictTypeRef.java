package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * A dictionary annotation {@code Dict[K, V]}.
 *
 * @param key The key annotation.
 * @param value The value annotation.
 * @param span The source range from {@code Dict} to ']'.
 */
public record DictTypeRef(TypeRef key, TypeRef value, Span span) implements TypeRef {

    @Override
    public List<AstNode> getChildren() {
        return List.of(key, value);
    }

    @Override
    public String display() {
        return "Dict[" + key.display() + ", " + value.display() + "]";
    }
}
