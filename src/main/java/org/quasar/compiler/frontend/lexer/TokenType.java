package org.quasar.compiler.frontend.lexer;

/**
 * Defines all possible types of tokens that the lexer can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** An opening parenthesis '('. */
    LEFT_PAREN,
    /** A closing parenthesis ')'. */
    RIGHT_PAREN,
    /** An opening brace '{'. */
    LEFT_BRACE,
    /** A closing brace '}'. */
    RIGHT_BRACE,
    /** An opening bracket '['. */
    LEFT_BRACKET,
    /** A closing bracket ']'. */
    RIGHT_BRACKET,
    /** A comma ','. */
    COMMA,
    /** A colon ':'. */
    COLON,
    /** A dot '.', used for member access and method calls. */
    DOT,
    /** A plus sign '+'. */
    PLUS,
    /** A minus sign '-'. */
    MINUS,
    /** An asterisk '*'. */
    STAR,
    /** A slash '/'. */
    SLASH,
    /** A percent sign '%'. */
    PERCENT,

    // One or two character tokens.
    /** A logical not '!'. */
    BANG,
    /** Inequality '!='. */
    BANG_EQUAL,
    /** Assignment '='. */
    EQUAL,
    /** Equality '=='. */
    EQUAL_EQUAL,
    /** Less than '<'. */
    LESS,
    /** Less than or equal '<='. */
    LESS_EQUAL,
    /** Greater than '>'. */
    GREATER,
    /** Greater than or equal '>='. */
    GREATER_EQUAL,
    /** Logical and '&&'. */
    AND_AND,
    /** Logical or '||'. */
    OR_OR,
    /** The return type arrow '->'. */
    ARROW,
    /** The range operator '..'. */
    DOT_DOT,

    // Literals.
    /** An identifier (variable, function, struct, enum or module name). */
    IDENTIFIER,
    /** An integer literal, e.g., 42. */
    INT_LITERAL,
    /** A floating-point literal, e.g., 3.14. */
    FLOAT_LITERAL,
    /** A string literal, e.g., "hello". */
    STRING_LITERAL,

    // Keywords.
    LET, CONST, FN, RETURN, IF, ELSE, WHILE, FOR, IN, BREAK, CONTINUE,
    TRUE, FALSE, PRINT, STRUCT, ENUM, IMPORT, SEP, END,
    /** The primitive type keywords. */
    INT, FLOAT, BOOL, STR, VOID,

    // End of file.
    /** Marks the end of the token stream. */
    END_OF_FILE;

    /**
     * Checks whether this token names one of the castable primitive types.
     * @return {@code true} for {@code int}, {@code float}, {@code bool} and {@code str}.
     */
    public boolean isPrimitiveTypeKeyword() {
        return this == INT || this == FLOAT || this == BOOL || this == STR;
    }
}
