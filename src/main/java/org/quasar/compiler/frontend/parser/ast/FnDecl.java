package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A function declaration {@code fn name(params) -> returnType { body }}.
 *
 * @param name The function name.
 * @param params The parameters in declaration order.
 * @param returnType The declared return annotation, possibly {@code void}.
 * @param body The function body.
 * @param span The source range from {@code fn} to the end of the body.
 */
public record FnDecl(String name, List<Param> params, TypeRef returnType, Block body, Span span) implements Declaration {

    public FnDecl {
        params = List.copyOf(params);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(params);
        children.add(returnType);
        children.add(body);
        return children;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFnDecl(this);
    }
}
