package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A method call such as {@code name.upper()} or {@code File.exists(path)}.
 *
 * @param object The receiver expression.
 * @param method The method name.
 * @param arguments The argument expressions.
 * @param span The source range from the receiver to the closing parenthesis.
 */
public record MethodCall(Expression object, String method, List<Expression> arguments, Span span) implements Expression {

    public MethodCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(object);
        children.addAll(arguments);
        return children;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMethodCall(this);
    }
}
