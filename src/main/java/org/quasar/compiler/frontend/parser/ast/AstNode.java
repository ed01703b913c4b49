package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable records and own their children exclusively.
 */
public interface AstNode {

    /**
     * Returns the source range of this node. Composite nodes cover all of their children.
     * @return The span of this node.
     */
    Span span();

    /**
     * Returns all direct child nodes of this AST node.
     * The default implementation returns an empty list for leaf nodes.
     *
     * @return A list of child nodes, never null.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
