package org.quasar.compiler;

import org.quasar.compiler.api.CompilationException;
import org.quasar.compiler.api.CompilerErrorCode;
import org.quasar.compiler.config.FrontendOptions;
import org.quasar.compiler.diagnostics.CompilerLogger;
import org.quasar.compiler.diagnostics.FrontendError;
import org.quasar.compiler.frontend.parser.SyntaxError;
import org.quasar.compiler.frontend.semantics.AnalyzedProgram;
import org.quasar.compiler.frontend.semantics.SemanticError;
import org.quasar.junit.extensions.logging.ExpectLog;
import org.quasar.junit.extensions.logging.LogLevel;
import org.quasar.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains end-to-end tests for the front-end pipeline.
 */
@ExtendWith(LogWatchExtension.class)
public class CompilerTest {

    private Compiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new Compiler(new FrontendOptions("<stdin>", Path.of("."), CompilerLogger.INFO), path -> true);
    }

    /**
     * Verifies that a valid program passes all three phases.
     */
    @Test
    @Tag("unit")
    void testCompilesValidProgram() throws CompilationException {
        // Arrange
        String source = """
                struct Point { x: int, y: int }
                fn norm(p: Point) -> int {
                    return p.x * p.x + p.y * p.y
                }
                let p: Point = Point { x: 3, y: 4 }
                print("{}", norm(p))
                """;

        // Act
        AnalyzedProgram program = compiler.compile(source, "main.qsr");

        // Assert
        assertThat(program.program().items()).hasSize(4);
        assertThat(program.declaredTypes()).containsKey("Point");
        assertThat(compiler.getDiagnostics().hasErrors()).isFalse();
    }

    /**
     * Verifies that a lexical error stops the pipeline and is reported in display form.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*failed lexing.*")
    void testLexicalErrorIsRaised() {
        // Act
        CompilationException exception = catchThrowableOfType(
                () -> compiler.compile("let x: int = @", "main.qsr"), CompilationException.class);

        // Assert
        assertThat(exception.getMessage()).isEqualTo("main.qsr:1:14: lexical error: unexpected character '@'");
        assertThat(exception.getError()).isEmpty();
        assertThat(compiler.getDiagnostics().hasErrors()).isTrue();
    }

    /**
     * Verifies that a syntax error carries the structured error.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*failed parsing.*")
    void testSyntaxErrorIsRaised() {
        // Act
        CompilationException exception = catchThrowableOfType(
                () -> compiler.compile("let x: int = ", "main.qsr"), CompilationException.class);

        // Assert
        assertThat(exception.getError()).get().isInstanceOf(SyntaxError.class);
        FrontendError error = exception.getError().orElseThrow();
        assertThat(exception.getMessage()).isEqualTo(error.display());
        assertThat(error.code()).isEqualTo(SyntaxError.CODE);
    }

    /**
     * Verifies that a semantic error carries the structured error and is recorded in the diagnostics.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*failed analysis.*")
    void testSemanticErrorIsRaised() {
        // Act
        CompilationException exception = catchThrowableOfType(
                () -> compiler.compile("let x: int = \"a\"", "main.qsr"), CompilationException.class);

        // Assert
        SemanticError error = (SemanticError) exception.getError().orElseThrow();
        assertThat(error.errorCode()).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(exception.getMessage()).startsWith("main.qsr:1:14: E0100: ");
        assertThat(compiler.getDiagnostics().getDiagnostics()).hasSize(1);
    }

    /**
     * Verifies that a blank source id falls back to the configured default.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*<stdin> failed analysis.*")
    void testBlankSourceIdUsesDefault() {
        assertThatThrownBy(() -> compiler.compile("print(y)", " "))
                .isInstanceOf(CompilationException.class)
                .hasMessageStartingWith("<stdin>:1:7: E0001");
    }

    /**
     * Verifies that a verbosity override silences the failure warning.
     */
    @Test
    @Tag("unit")
    void testVerbosityOverride() {
        // Arrange
        compiler.setVerbosity(CompilerLogger.ERROR);

        // Act & Assert
        assertThatThrownBy(() -> compiler.compile("break", "main.qsr")).isInstanceOf(CompilationException.class);
        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.ERROR);
    }

    /**
     * Verifies that a file is compiled under its own path as source id.
     */
    @Test
    @Tag("unit")
    void testCompilesFile(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve("hello.qsr");
        Files.writeString(file, "let greeting: str = \"hello\"\nprint(greeting)\n");

        // Act
        AnalyzedProgram program = compiler.compile(file);

        // Assert
        assertThat(program.program().items()).hasSize(2);
        assertThat(program.program().span().sourceId()).isEqualTo(file.toString().replace('\\', '/'));
    }
}
