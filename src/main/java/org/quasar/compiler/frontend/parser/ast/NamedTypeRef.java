package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * A reference to a struct or enum by name.
 *
 * @param name The referenced type name.
 * @param span The span of the name.
 */
public record NamedTypeRef(String name, Span span) implements TypeRef {

    @Override
    public String display() {
        return name;
    }
}
