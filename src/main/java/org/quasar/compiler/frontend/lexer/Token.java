package org.quasar.compiler.frontend.lexer;

import org.quasar.compiler.diagnostics.Span;

/**
 * Represents a single token that was recognized by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., IDENTIFIER, INT_LITERAL).
 * @param text The original text of the token from the source code.
 * @param value The literal value of the token (a {@link Long}, {@link Double}, {@link String} or {@link Boolean}), or null.
 * @param span The source range of the token.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        Span span
) {
    /**
     * @return The line of the token's first character.
     */
    public int line() {
        return span.startLine();
    }

    /**
     * @return The column of the token's first character.
     */
    public int column() {
        return span.startColumn();
    }

    /**
     * @return The logical source name the token was read from.
     */
    public String fileName() {
        return span.sourceId();
    }
}
