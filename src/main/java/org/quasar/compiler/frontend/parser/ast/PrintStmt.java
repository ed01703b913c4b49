package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code print(...)} statement with optional {@code sep=} and {@code end=} keyword arguments.
 * When the first argument is a string literal containing <code>{}</code> placeholders and more
 * arguments follow, the first argument is a format string.
 *
 * @param arguments The positional arguments, at least one.
 * @param separator The {@code sep} expression, or null.
 * @param terminator The {@code end} expression, or null.
 * @param span The source range from {@code print} to the closing parenthesis.
 */
public record PrintStmt(List<Expression> arguments, Expression separator, Expression terminator, Span span) implements Statement {

    public PrintStmt {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(arguments);
        if (separator != null) children.add(separator);
        if (terminator != null) children.add(terminator);
        return children;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPrintStmt(this);
    }
}
