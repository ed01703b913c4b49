package org.quasar.compiler.frontend.parser.ast;

/**
 * A type annotation as written in source. Named references are resolved to struct or enum
 * types during semantic analysis.
 */
public sealed interface TypeRef extends AstNode permits PrimitiveTypeRef, ListTypeRef, DictTypeRef, NamedTypeRef {

    /**
     * @return The annotation as it would be written in source.
     */
    String display();
}
