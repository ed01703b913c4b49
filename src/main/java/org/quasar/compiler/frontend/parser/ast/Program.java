package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of a parsed source: top-level declarations and statements in source order.
 *
 * @param items The top-level items.
 * @param span The source range of the whole program.
 */
public record Program(List<Statement> items, Span span) implements AstNode {

    public Program {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(items);
    }
}
