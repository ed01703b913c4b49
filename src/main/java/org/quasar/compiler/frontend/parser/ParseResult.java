package org.quasar.compiler.frontend.parser;

import org.quasar.compiler.frontend.parser.ast.Program;

/**
 * The outcome of {@link Parser#parse()}: either a complete program or the first syntax error.
 */
public sealed interface ParseResult {

    /**
     * @return {@code true} if parsing produced a program.
     */
    boolean isSuccess();

    /**
     * A successful parse.
     * @param program The parsed program.
     */
    record Success(Program program) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * A rejected token stream. No partial tree is returned.
     * @param error The first syntax error.
     */
    record Failure(SyntaxError error) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
