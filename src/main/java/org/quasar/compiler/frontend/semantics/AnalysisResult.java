package org.quasar.compiler.frontend.semantics;

/**
 * The outcome of {@link SemanticAnalyzer#analyze}: the validated program or the first violation.
 */
public sealed interface AnalysisResult {

    /**
     * @return {@code true} if the program passed analysis.
     */
    boolean isSuccess();

    /**
     * A program that passed every check.
     * @param program The validated, type-annotated program.
     */
    record Success(AnalyzedProgram program) implements AnalysisResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * A rejected program.
     * @param error The first semantic error.
     */
    record Failure(SemanticError error) implements AnalysisResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
