package org.quasar.compiler.diagnostics;

import org.quasar.compiler.api.CompilerErrorCode;
import org.quasar.compiler.frontend.parser.SyntaxError;
import org.quasar.compiler.frontend.semantics.SemanticError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link DiagnosticsEngine} and {@link Span}.
 */
public class DiagnosticsEngineTest {

    /**
     * Verifies that warnings are collected but do not count as errors.
     */
    @Test
    @Tag("unit")
    void testWarningsAreNotErrors() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning("W0001", "unused variable 'x'", Span.at(2, 5, "main.qsr"));

        // Assert
        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.firstError()).isEmpty();
        assertThat(engine.getDiagnostics()).hasSize(1);
    }

    /**
     * Verifies that the first error is returned and the summary lists all diagnostics.
     */
    @Test
    @Tag("unit")
    void testFirstErrorAndSummary() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("W0001", "unused variable 'x'", Span.at(1, 1, "main.qsr"));
        engine.reportError("E0001", "use of undeclared identifier 'y'", Span.at(2, 7, "main.qsr"));
        engine.reportError("E0100", "type mismatch", Span.at(3, 1, "main.qsr"));

        // Act
        Diagnostic first = engine.firstError().orElseThrow();

        // Assert
        assertThat(first.display()).isEqualTo("main.qsr:2:7: E0001: use of undeclared identifier 'y'");
        assertThat(engine.summary().split("\n")).hasSize(3);
        assertThat(engine.summary()).startsWith("[WARNING] main.qsr:1:1: W0001: ");
    }

    /**
     * Verifies that syntax and semantic errors from the other front-end packages are
     * recorded through the shared {@link FrontendError} contract.
     */
    @Test
    @Tag("unit")
    void testFrontendErrorsFromBothStages() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();
        FrontendError syntax = new SyntaxError("expected expression", Span.at(1, 9, "main.qsr"));
        FrontendError semantic = new SemanticError(CompilerErrorCode.UNDECLARED_IDENTIFIER,
                "use of undeclared identifier 'y'", Span.at(2, 7, "main.qsr"));

        // Act
        engine.report(syntax);
        engine.report(semantic);

        // Assert
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::display).containsExactly(
                "main.qsr:1:9: syntax error: expected expression",
                "main.qsr:2:7: E0001: use of undeclared identifier 'y'");
        assertThat(semantic.display()).isEqualTo(engine.getDiagnostics().get(1).display());
    }

    /**
     * Verifies span merging and containment across lines.
     */
    @Test
    @Tag("unit")
    void testSpanMergeAndContains() {
        // Arrange
        Span inner = new Span(2, 3, 2, 8, "main.qsr");
        Span outer = new Span(1, 1, 4, 1, "main.qsr");

        // Act
        Span merged = Span.merge(inner, new Span(3, 1, 3, 4, "main.qsr"));

        // Assert
        assertThat(merged).isEqualTo(new Span(2, 3, 3, 4, "main.qsr"));
        assertThat(outer.contains(merged)).isTrue();
        assertThat(merged.contains(outer)).isFalse();
        assertThat(merged.toString()).isEqualTo("main.qsr:2:3");
    }
}
