package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * One of the primitive type keywords, or {@code void} in return position.
 *
 * @param keyword The keyword as written ({@code int}, {@code float}, {@code bool}, {@code str} or {@code void}).
 * @param span The span of the keyword.
 */
public record PrimitiveTypeRef(String keyword, Span span) implements TypeRef {

    @Override
    public String display() {
        return keyword;
    }
}
