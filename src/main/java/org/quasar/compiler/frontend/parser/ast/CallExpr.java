package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A call of a named function, built-in function or cast, e.g. {@code len(xs)} or {@code int(s)}.
 *
 * @param callee The called name. The parser only accepts bare identifiers as callees.
 * @param arguments The argument expressions.
 * @param span The source range from the callee to the closing parenthesis.
 */
public record CallExpr(String callee, List<Expression> arguments, Span span) implements Expression {

    public CallExpr {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCallExpr(this);
    }
}
