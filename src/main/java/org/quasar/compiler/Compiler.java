package org.quasar.compiler;

import org.quasar.compiler.api.CompilationException;
import org.quasar.compiler.api.ICompiler;
import org.quasar.compiler.config.ConfigLoader;
import org.quasar.compiler.config.FrontendOptions;
import org.quasar.compiler.diagnostics.CompilerLogger;
import org.quasar.compiler.diagnostics.Diagnostic;
import org.quasar.compiler.diagnostics.DiagnosticsEngine;
import org.quasar.compiler.frontend.lexer.Lexer;
import org.quasar.compiler.frontend.lexer.Token;
import org.quasar.compiler.frontend.parser.ParseResult;
import org.quasar.compiler.frontend.parser.Parser;
import org.quasar.compiler.frontend.semantics.AnalysisResult;
import org.quasar.compiler.frontend.semantics.AnalyzedProgram;
import org.quasar.compiler.frontend.semantics.FileSystemModuleResolver;
import org.quasar.compiler.frontend.semantics.ModuleResolver;
import org.quasar.compiler.frontend.semantics.SemanticAnalyzer;

import java.util.List;

/**
 * The front-end pipeline: lexing, parsing and semantic analysis of one source text.
 * Every {@link #compile(String, String)} call uses a fresh {@link DiagnosticsEngine};
 * the engine of the most recent call stays available through {@link #getDiagnostics()}.
 * It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private final FrontendOptions options;
    private final ModuleResolver moduleResolver;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private int verbosity = -1;

    /**
     * Constructs a compiler configured from {@link ConfigLoader#load()}.
     */
    public Compiler() {
        this(FrontendOptions.fromConfig(ConfigLoader.load()));
    }

    /**
     * Constructs a compiler that resolves local imports against the configured base directory.
     * @param options The front-end options.
     */
    public Compiler(FrontendOptions options) {
        this(options, new FileSystemModuleResolver(options.moduleBaseDirectory()));
    }

    /**
     * Constructs a compiler with an explicit module resolver.
     * @param options The front-end options.
     * @param moduleResolver Decides whether a local import path exists.
     */
    public Compiler(FrontendOptions options, ModuleResolver moduleResolver) {
        this.options = options;
        this.moduleResolver = moduleResolver;
    }

    /**
     * {@inheritDoc}
     * <p>
     * A null or blank {@code sourceId} falls back to the configured default source id.
     */
    @Override
    public AnalyzedProgram compile(String source, String sourceId) throws CompilationException {
        CompilerLogger.setLevel(verbosity >= 0 ? verbosity : options.verbosity());
        String name = sourceId == null || sourceId.isBlank() ? options.defaultSourceId() : sourceId;
        diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics, name).scanTokens();
        if (diagnostics.hasErrors()) {
            Diagnostic first = diagnostics.firstError().orElseThrow();
            CompilerLogger.warn("Compiler: {} failed lexing: {}", name, first.message());
            throw new CompilationException(first.display());
        }
        CompilerLogger.debug("Compiler: {} tokens in {}", tokens.size(), name);

        // Phase 2: Parsing
        ParseResult parsed = new Parser(tokens, diagnostics).parse();
        if (parsed instanceof ParseResult.Failure failure) {
            CompilerLogger.warn("Compiler: {} failed parsing: {}", name, failure.error().message());
            throw new CompilationException(failure.error());
        }

        // Phase 3: Semantic Analysis
        AnalysisResult analyzed = new SemanticAnalyzer(diagnostics, moduleResolver)
                .analyze(((ParseResult.Success) parsed).program());
        if (analyzed instanceof AnalysisResult.Failure failure) {
            CompilerLogger.warn("Compiler: {} failed analysis: {}", name, failure.error().message());
            throw new CompilationException(failure.error());
        }

        AnalyzedProgram program = ((AnalysisResult.Success) analyzed).program();
        CompilerLogger.info("Compiler: {} analyzed ({} top-level items)", name, program.program().items().size());
        return program;
    }

    /**
     * Sets the verbosity level, overriding the configured one for subsequent compilations.
     * @param level The new verbosity level.
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics of the most recent compilation.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
