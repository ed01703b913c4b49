package org.quasar.compiler.api;

import org.quasar.compiler.frontend.semantics.AnalyzedProgram;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the quasar front end.
 */
public interface ICompiler {

    /**
     * Lexes, parses and analyzes the given source code.
     *
     * @param source The complete source text.
     * @param sourceId A name for the source, used in every diagnostic span.
     * @return The analyzed program, ready for an emitter.
     * @throws CompilationException if the source has a lexical, syntax or semantic error.
     */
    AnalyzedProgram compile(String source, String sourceId) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=error ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the source file.
     * @return The analyzed program.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default AnalyzedProgram compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readString(programPath), programPath.toString().replace('\\', '/'));
    }
}
