package org.quasar.compiler.frontend.parser.ast;

/**
 * The prefix operators.
 */
public enum UnaryOperator {
    /** Logical negation '!'. */
    NOT("!"),
    /** Arithmetic negation '-'. */
    NEGATE("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
