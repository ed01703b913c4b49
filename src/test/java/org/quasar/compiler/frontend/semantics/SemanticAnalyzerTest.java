package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.api.CompilerErrorCode;
import org.quasar.compiler.diagnostics.Diagnostic;
import org.quasar.compiler.diagnostics.DiagnosticsEngine;
import org.quasar.compiler.frontend.lexer.Lexer;
import org.quasar.compiler.frontend.parser.ParseResult;
import org.quasar.compiler.frontend.parser.Parser;
import org.quasar.compiler.frontend.parser.ast.IntLiteral;
import org.quasar.compiler.frontend.parser.ast.Program;
import org.quasar.compiler.frontend.parser.ast.VarDecl;
import org.quasar.compiler.types.PrimitiveType;
import org.quasar.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SemanticAnalyzer} covering name binding, scoping,
 * functions, control flow and definite-return analysis.
 * All tests are pure unit tests and do not require external resources.
 */
@ExtendWith(LogWatchExtension.class)
public class SemanticAnalyzerTest {

    private Program parse(String source, DiagnosticsEngine diagnostics) {
        ParseResult parsed = new Parser(new Lexer(source, diagnostics, "main.qsr").scanTokens(), diagnostics).parse();
        assertThat(parsed).as("parse of: %s", source).isInstanceOf(ParseResult.Success.class);
        return ((ParseResult.Success) parsed).program();
    }

    private AnalysisResult analyze(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        return new SemanticAnalyzer(diagnostics, path -> true).analyze(parse(source, diagnostics));
    }

    private AnalyzedProgram programOf(String source) {
        AnalysisResult result = analyze(source);
        assertThat(result).as("analysis of: %s", source).isInstanceOf(AnalysisResult.Success.class);
        return ((AnalysisResult.Success) result).program();
    }

    private SemanticError errorOf(String source) {
        AnalysisResult result = analyze(source);
        assertThat(result).as("analysis of: %s", source).isInstanceOf(AnalysisResult.Failure.class);
        return ((AnalysisResult.Failure) result).error();
    }

    private void assertError(String source, CompilerErrorCode expected) {
        assertThat(errorOf(source).errorCode()).as("error code for: %s", source).isEqualTo(expected);
    }

    /**
     * Verifies that a well-formed program passes and that expression types are recorded
     * in the side table without modifying the tree.
     */
    @Test
    @Tag("unit")
    void testValidProgramRecordsExpressionTypes() {
        // Arrange
        String source = String.join("\n",
                "fn fib(n: int) -> int {",
                "    if n < 2 { return n }",
                "    return fib(n - 1) + fib(n - 2)",
                "}",
                "let total: int = fib(10) * 2",
                "print(\"fib: {}\", total)");

        // Act
        AnalyzedProgram analyzed = programOf(source);

        // Assert
        VarDecl total = (VarDecl) analyzed.program().items().get(1);
        assertThat(analyzed.typeOf(total.initializer())).isEqualTo(PrimitiveType.INT);
        assertThat(analyzed.typedExpressionCount()).isGreaterThan(10);
        assertThatThrownBy(() -> analyzed.typeOf(new IntLiteral(1, total.span())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Verifies that an unknown name is reported with its position and stable code, both in
     * the result and in the diagnostics engine.
     */
    @Test
    @Tag("unit")
    void testUndeclaredIdentifierIsReported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Program program = parse("print(y)", diagnostics);

        // Act
        AnalysisResult result = new SemanticAnalyzer(diagnostics, path -> true).analyze(program);

        // Assert
        assertThat(result.isSuccess()).isFalse();
        SemanticError error = ((AnalysisResult.Failure) result).error();
        assertThat(error.code()).isEqualTo("E0001");
        assertThat(error.display()).isEqualTo("main.qsr:1:7: E0001: use of undeclared identifier 'y'");
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic reported = diagnostics.firstError().orElseThrow();
        assertThat(reported.code()).isEqualTo("E0001");
        assertThat(reported.span()).isEqualTo(error.span());
    }

    /**
     * Verifies same-scope redeclaration is rejected while shadowing in a nested block is allowed
     * and ends with the block.
     */
    @Test
    @Tag("unit")
    void testScopingRules() {
        assertError("let a: int = 1\nlet a: int = 2", CompilerErrorCode.REDECLARATION);
        programOf("let a: int = 1\n{ let a: str = \"inner\" }\nlet b: int = a");
        assertError("{ let b: int = 1 }\nprint(b)", CompilerErrorCode.UNDECLARED_IDENTIFIER);
        assertError("for i in 0..3 { }\nprint(i)", CompilerErrorCode.UNDECLARED_IDENTIFIER);
        programOf("fn f(x: int) -> int { if x > 0 { let x: int = 2 return x } return x }");
        assertError("fn f(x: int) -> int { let x: int = 2 return x }", CompilerErrorCode.REDECLARATION);
    }

    /**
     * Verifies that constants, functions and type names cannot be assigned to.
     */
    @Test
    @Tag("unit")
    void testAssignmentToConstantsIsRejected() {
        SemanticError error = errorOf("const limit: int = 1\nlimit = 2");
        assertThat(error.errorCode()).isEqualTo(CompilerErrorCode.CONST_REASSIGNMENT);
        assertThat(error.message()).isEqualTo("cannot assign to constant 'limit'");

        assertError("fn f() -> void { }\nf = 1", CompilerErrorCode.CONST_REASSIGNMENT);
        assertError("x = 1", CompilerErrorCode.UNDECLARED_IDENTIFIER);
    }

    /**
     * Verifies declaration and assignment type checks, including the absence of numeric widening.
     */
    @Test
    @Tag("unit")
    void testDeclarationAndAssignmentTypes() {
        assertError("let x: int = \"a\"", CompilerErrorCode.TYPE_MISMATCH);
        assertError("let f: float = 1", CompilerErrorCode.TYPE_MISMATCH);
        assertError("let x: int = 1\nx = true", CompilerErrorCode.TYPE_MISMATCH);
        programOf("let x: int = 1\nx = x + 1");
    }

    /**
     * Verifies that if and while conditions must be bool.
     */
    @Test
    @Tag("unit")
    void testConditionsMustBeBool() {
        SemanticError error = errorOf("if 1 { print(1) }");
        assertThat(error.errorCode()).isEqualTo(CompilerErrorCode.NON_BOOL_CONDITION);
        assertThat(error.message()).startsWith("condition must be bool");

        assertError("while \"yes\" { break }", CompilerErrorCode.NON_BOOL_CONDITION);
        programOf("let go: bool = true\nwhile go { go = false }");
    }

    /**
     * Verifies that break and continue are only allowed inside loops, and that a function body
     * does not inherit the loop of its declaration site.
     */
    @Test
    @Tag("unit")
    void testLoopControlOutsideLoop() {
        assertError("break", CompilerErrorCode.BREAK_OUTSIDE_LOOP);
        assertError("if true { continue }", CompilerErrorCode.CONTINUE_OUTSIDE_LOOP);
        assertError("while true { fn f() -> void { break } }", CompilerErrorCode.BREAK_OUTSIDE_LOOP);
        programOf("for i in 0..10 { if i == 5 { break } else { continue } }");
    }

    /**
     * Verifies the return statement rules.
     */
    @Test
    @Tag("unit")
    void testReturnRules() {
        SemanticError outside = errorOf("return 1");
        assertThat(outside.errorCode()).isEqualTo(CompilerErrorCode.RETURN_OUTSIDE_FUNCTION);
        assertThat(outside.message()).isEqualTo("return outside of function");

        SemanticError mismatch = errorOf("fn f() -> int { return \"s\" }");
        assertThat(mismatch.errorCode()).isEqualTo(CompilerErrorCode.RETURN_TYPE_MISMATCH);
        assertThat(mismatch.message()).isEqualTo("return type mismatch: expected int, got str");

        assertError("fn f() -> int { return }", CompilerErrorCode.RETURN_TYPE_MISMATCH);
        programOf("fn f() -> void { return }");
    }

    /**
     * Verifies definite-return analysis: an if returns on all paths only with an else whose
     * both branches return, and loops never count.
     */
    @Test
    @Tag("unit")
    void testDefiniteReturnAnalysis() {
        SemanticError error = errorOf("fn sign(n: int) -> int { if n > 0 { return 1 } }");
        assertThat(error.errorCode()).isEqualTo(CompilerErrorCode.MISSING_RETURN);
        assertThat(error.message()).isEqualTo("function 'sign' may not return a value on all paths");

        assertError("fn f() -> int { while true { return 1 } }", CompilerErrorCode.MISSING_RETURN);
        assertError("fn f() -> int { for i in 0..3 { return i } }", CompilerErrorCode.MISSING_RETURN);
        assertError("fn f() -> int { }", CompilerErrorCode.MISSING_RETURN);
        programOf("fn sign(n: int) -> int { if n > 0 { return 1 } else if n < 0 { return -1 } else { return 0 } }");
        programOf("fn f() -> int { { return 1 } }");
        programOf("fn f() -> void { print(1) }");
    }

    /**
     * Verifies argument count and argument type checks of user function calls.
     */
    @Test
    @Tag("unit")
    void testUserFunctionCalls() {
        String declaration = "fn twice(a: int) -> int { return a * 2 }\n";

        SemanticError arity = errorOf(declaration + "let x: int = twice(1, 2)");
        assertThat(arity.errorCode()).isEqualTo(CompilerErrorCode.ARGUMENT_COUNT_MISMATCH);
        assertThat(arity.message()).isEqualTo("function 'twice' expects 1 argument(s), got 2");

        assertError(declaration + "let x: int = twice(\"s\")", CompilerErrorCode.ARGUMENT_TYPE_MISMATCH);
        assertError(declaration + "let x: str = twice(1)", CompilerErrorCode.TYPE_MISMATCH);

        SemanticError unknown = errorOf("launch()");
        assertThat(unknown.errorCode()).isEqualTo(CompilerErrorCode.UNDECLARED_IDENTIFIER);
        assertThat(unknown.message()).isEqualTo("use of undeclared function 'launch'");

        assertError("let v: int = 1\nv()", CompilerErrorCode.TYPE_MISMATCH);
    }

    /**
     * Verifies that duplicate parameters are rejected and that parameters are scoped to the body.
     */
    @Test
    @Tag("unit")
    void testParameters() {
        SemanticError error = errorOf("fn f(a: int, a: int) -> void { }");
        assertThat(error.errorCode()).isEqualTo(CompilerErrorCode.REDECLARATION);
        assertThat(error.message()).isEqualTo("redeclaration of parameter 'a'");

        assertError("fn f(a: int) -> void { }\nprint(a)", CompilerErrorCode.UNDECLARED_IDENTIFIER);
        assertError("fn f(a: int) -> void { let a: int = 2 }", CompilerErrorCode.REDECLARATION);
    }

    /**
     * Verifies that the built-in namespace names cannot be declared in any form.
     */
    @Test
    @Tag("unit")
    void testBuiltinNamespacesAreReserved() {
        SemanticError error = errorOf("let File: int = 1");
        assertThat(error.errorCode()).isEqualTo(CompilerErrorCode.RESERVED_IDENTIFIER);
        assertThat(error.message()).isEqualTo("cannot shadow builtin module 'File'");

        assertError("fn Env() -> void { }", CompilerErrorCode.RESERVED_IDENTIFIER);
        assertError("fn f(File: int) -> void { }", CompilerErrorCode.RESERVED_IDENTIFIER);
        assertError("for Env in 0..2 { }", CompilerErrorCode.RESERVED_IDENTIFIER);
        assertError("struct File { x: int }", CompilerErrorCode.RESERVED_IDENTIFIER);

        assertThat(BuiltinRegistry.namespaces()).containsExactly("File", "Env");
        for (String namespace : BuiltinRegistry.namespaces()) {
            assertError("let " + namespace + ": int = 1", CompilerErrorCode.RESERVED_IDENTIFIER);
        }
    }

    /**
     * Verifies the loop variable takes the element type of the iterable and that
     * non-list values cannot be iterated.
     */
    @Test
    @Tag("unit")
    void testForLoopVariableType() {
        assertError("for i in 0..3 { let s: str = i }", CompilerErrorCode.TYPE_MISMATCH);
        programOf("let names: [str] = [\"a\"]\nfor n in names { let s: str = n }");

        SemanticError error = errorOf("for c in 5 { }");
        assertThat(error.errorCode()).isEqualTo(CompilerErrorCode.NOT_ITERABLE);
        assertThat(error.message()).isEqualTo("cannot iterate over type 'int'");
    }

    /**
     * Verifies that a type name is not a value.
     */
    @Test
    @Tag("unit")
    void testTypeNameIsNotAValue() {
        assertError("struct P { x: int }\nprint(P)", CompilerErrorCode.UNDECLARED_IDENTIFIER);
    }

    /**
     * Verifies that every analysis run starts from an empty global scope.
     */
    @Test
    @Tag("unit")
    void testAnalyzerIsStatelessAcrossRuns() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Program program = parse("let a: int = 1", diagnostics);
        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics, path -> true);

        // Act
        AnalysisResult first = analyzer.analyze(program);
        AnalysisResult second = analyzer.analyze(program);

        // Assert
        assertThat(first.isSuccess()).isTrue();
        assertThat(second.isSuccess()).isTrue();
        assertThat(diagnostics.hasErrors()).isFalse();
    }
}
