package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * One variant name of an {@link EnumDecl}.
 *
 * @param name The variant name.
 * @param span The span of the name.
 */
public record EnumVariant(String name, Span span) implements AstNode {
}
