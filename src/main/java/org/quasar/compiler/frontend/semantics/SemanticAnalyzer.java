package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.diagnostics.CompilerLogger;
import org.quasar.compiler.diagnostics.DiagnosticsEngine;
import org.quasar.compiler.frontend.parser.ast.Program;
import org.quasar.compiler.frontend.parser.ast.Statement;

import java.nio.file.Path;

/**
 * Performs semantic analysis on a parsed program: name resolution, type checking,
 * control-flow validation and definite-return analysis.
 * <p>
 * Analysis is fail-fast. The first violated rule ends the run, is reported to the
 * {@link DiagnosticsEngine} and is returned as {@link AnalysisResult.Failure}.
 * Each call to {@link #analyze(Program)} starts from an empty global scope.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final ModuleResolver moduleResolver;

    /**
     * Constructs an analyzer that resolves local imports against the working directory.
     * @param diagnostics The engine the semantic error is reported to.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this(diagnostics, new FileSystemModuleResolver(Path.of("")));
    }

    /**
     * Constructs an analyzer.
     * @param diagnostics The engine the semantic error is reported to.
     * @param moduleResolver Decides whether a local import path exists.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, ModuleResolver moduleResolver) {
        this.diagnostics = diagnostics;
        this.moduleResolver = moduleResolver;
    }

    /**
     * Analyzes a program.
     * @param program The program as produced by the parser.
     * @return The analyzed program with its expression types, or the first semantic error.
     */
    public AnalysisResult analyze(Program program) {
        AnalysisContext context = new AnalysisContext(moduleResolver);
        StatementChecker checker = new StatementChecker(context);
        try {
            for (Statement item : program.items()) {
                checker.check(item);
            }
        } catch (AnalysisContext.SemanticAbort abort) {
            SemanticError error = abort.error();
            diagnostics.report(error);
            CompilerLogger.debug("SemanticAnalyzer: {}", error.display());
            return new AnalysisResult.Failure(error);
        }
        CompilerLogger.debug("SemanticAnalyzer: typed {} expressions, {} user types",
                context.expressionTypes.size(), context.declaredTypes.size());
        return new AnalysisResult.Success(new AnalyzedProgram(program, context.expressionTypes, context.declaredTypes));
    }
}
