package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.api.CompilerErrorCode;
import org.quasar.compiler.diagnostics.Span;
import org.quasar.compiler.frontend.parser.ast.Expression;
import org.quasar.compiler.types.Type;

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The mutable state of a single analysis run: scopes, loop nesting, the enclosing function's
 * return type and the growing expression type table. Created fresh for every run.
 */
final class AnalysisContext {

    final SymbolTable symbols = new SymbolTable();
    final IdentityHashMap<Expression, Type> expressionTypes = new IdentityHashMap<>();
    final Map<String, Type> declaredTypes = new LinkedHashMap<>();
    final ModuleResolver moduleResolver;

    /** Number of enclosing loops of the statement being analyzed. */
    int loopDepth;
    /** Return type of the enclosing function, null at top level. */
    Type currentReturnType;

    AnalysisContext(ModuleResolver moduleResolver) {
        this.moduleResolver = moduleResolver;
    }

    /**
     * Builds the abort signal for a rule violation; callers throw the result.
     */
    SemanticAbort error(CompilerErrorCode code, String message, Span span) {
        return new SemanticAbort(new SemanticError(code, message, span));
    }

    /**
     * Rejects declarations that would shadow a static namespace such as {@code File}.
     */
    void checkNotReserved(String name, Span span) {
        if (BuiltinRegistry.isNamespace(name)) {
            throw error(CompilerErrorCode.RESERVED_IDENTIFIER, "cannot shadow builtin module '" + name + "'", span);
        }
    }

    /**
     * Unwinds the analysis to {@link SemanticAnalyzer#analyze}. Never escapes the analyzer.
     */
    static final class SemanticAbort extends RuntimeException {
        private final transient SemanticError error;

        SemanticAbort(SemanticError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }

        SemanticError error() {
            return error;
        }
    }
}
