package org.quasar.compiler.frontend.parser.ast;

/**
 * The binary operators, grouped by the type rule that applies to them.
 */
public enum BinaryOperator {
    ADD("+", Category.ARITHMETIC),
    SUBTRACT("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    MODULO("%", Category.ARITHMETIC),
    LESS("<", Category.RELATIONAL),
    GREATER(">", Category.RELATIONAL),
    LESS_EQUAL("<=", Category.RELATIONAL),
    GREATER_EQUAL(">=", Category.RELATIONAL),
    EQUAL("==", Category.EQUALITY),
    NOT_EQUAL("!=", Category.EQUALITY),
    AND("&&", Category.LOGICAL),
    OR("||", Category.LOGICAL);

    /** The operator classes checked by the semantic analyzer. */
    public enum Category { ARITHMETIC, RELATIONAL, EQUALITY, LOGICAL }

    private final String symbol;
    private final Category category;

    BinaryOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    /**
     * @return The operator as written in source.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return The operator class.
     */
    public Category category() {
        return category;
    }
}
