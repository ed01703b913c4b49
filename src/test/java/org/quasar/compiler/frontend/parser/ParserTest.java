package org.quasar.compiler.frontend.parser;

import org.quasar.compiler.diagnostics.DiagnosticsEngine;
import org.quasar.compiler.diagnostics.Span;
import org.quasar.compiler.frontend.lexer.Lexer;
import org.quasar.compiler.frontend.lexer.Token;
import org.quasar.compiler.frontend.parser.ast.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify operator precedence and associativity, the disambiguation of braces,
 * the shape of declarations and statements, and the reporting of syntax errors.
 * All tests are pure unit tests and do not require external resources.
 */
public class ParserTest {

    private ParseResult parse(String source, DiagnosticsEngine diagnostics) {
        List<Token> tokens = new Lexer(source, diagnostics, "main.qsr").scanTokens();
        return new Parser(tokens, diagnostics).parse();
    }

    private Program parseProgram(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ParseResult result = parse(source, diagnostics);
        assertThat(result).as("parse of: %s", source).isInstanceOf(ParseResult.Success.class);
        return ((ParseResult.Success) result).program();
    }

    private SyntaxError parseError(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ParseResult result = parse(source, diagnostics);
        assertThat(result).as("parse of: %s", source).isInstanceOf(ParseResult.Failure.class);
        assertThat(diagnostics.hasErrors()).isTrue();
        return ((ParseResult.Failure) result).error();
    }

    private Expression parseExpression(String source) {
        Program program = parseProgram(source);
        assertThat(program.items()).hasSize(1);
        return ((ExpressionStmt) program.items().get(0)).expression();
    }

    private Expression initializerOf(String source) {
        return ((VarDecl) parseProgram(source).items().get(0)).initializer();
    }

    /**
     * Verifies that multiplication binds tighter than addition.
     */
    @Test
    @Tag("unit")
    void testMultiplicationBindsTighterThanAddition() {
        // Act
        Expression expression = parseExpression("1 + 2 * 3");

        // Assert
        assertThat(expression).isInstanceOf(BinaryExpr.class);
        BinaryExpr add = (BinaryExpr) expression;
        assertThat(add.operator()).isEqualTo(BinaryOperator.ADD);
        assertThat(add.left()).isEqualTo(new IntLiteral(1, add.left().span()));
        assertThat(add.right()).isInstanceOf(BinaryExpr.class);
        assertThat(((BinaryExpr) add.right()).operator()).isEqualTo(BinaryOperator.MULTIPLY);
    }

    /**
     * Verifies that binary operators of the same precedence associate to the left.
     */
    @Test
    @Tag("unit")
    void testSubtractionIsLeftAssociative() {
        // Act
        BinaryExpr outer = (BinaryExpr) parseExpression("10 - 4 - 3");

        // Assert
        assertThat(outer.operator()).isEqualTo(BinaryOperator.SUBTRACT);
        assertThat(outer.left()).isInstanceOf(BinaryExpr.class);
        BinaryExpr inner = (BinaryExpr) outer.left();
        assertThat(((IntLiteral) inner.left()).value()).isEqualTo(10L);
        assertThat(((IntLiteral) inner.right()).value()).isEqualTo(4L);
        assertThat(((IntLiteral) outer.right()).value()).isEqualTo(3L);
    }

    /**
     * Verifies that prefix operators bind tighter than binary ones and that relational
     * operators bind tighter than logical ones.
     */
    @Test
    @Tag("unit")
    void testUnaryAndLogicalPrecedence() {
        // Act
        BinaryExpr product = (BinaryExpr) parseExpression("-x * 2");
        BinaryExpr conjunction = (BinaryExpr) parseExpression("!done && a < b || c");

        // Assert
        assertThat(product.operator()).isEqualTo(BinaryOperator.MULTIPLY);
        assertThat(product.left()).isInstanceOf(UnaryExpr.class);
        assertThat(((UnaryExpr) product.left()).operator()).isEqualTo(UnaryOperator.NEGATE);

        assertThat(conjunction.operator()).isEqualTo(BinaryOperator.OR);
        BinaryExpr and = (BinaryExpr) conjunction.left();
        assertThat(and.operator()).isEqualTo(BinaryOperator.AND);
        assertThat(and.left()).isInstanceOf(UnaryExpr.class);
        assertThat(((BinaryExpr) and.right()).operator()).isEqualTo(BinaryOperator.LESS);
    }

    /**
     * Verifies that parentheses override precedence.
     */
    @Test
    @Tag("unit")
    void testParenthesesOverridePrecedence() {
        // Act
        BinaryExpr product = (BinaryExpr) parseExpression("(1 + 2) * 3");

        // Assert
        assertThat(product.operator()).isEqualTo(BinaryOperator.MULTIPLY);
        assertThat(((BinaryExpr) product.left()).operator()).isEqualTo(BinaryOperator.ADD);
    }

    /**
     * Verifies that the range operator has the lowest precedence, so both bounds may be arithmetic.
     */
    @Test
    @Tag("unit")
    void testRangeHasLowestPrecedence() {
        // Act
        ForStmt loop = (ForStmt) parseProgram("for i in 0..n + 1 { print(i) }").items().get(0);

        // Assert
        assertThat(loop.variable()).isEqualTo("i");
        assertThat(loop.iterable()).isInstanceOf(RangeExpr.class);
        RangeExpr range = (RangeExpr) loop.iterable();
        assertThat(range.start()).isInstanceOf(IntLiteral.class);
        assertThat(range.end()).isInstanceOf(BinaryExpr.class);
        assertThat(loop.body().statements()).hasSize(1);
    }

    /**
     * Verifies that a brace after an identifier opens the loop body unless it is followed by
     * {@code IDENT :}, in which case it is a struct literal.
     */
    @Test
    @Tag("unit")
    void testStructLiteralVersusBlock() {
        // Act
        ForStmt loop = (ForStmt) parseProgram("for p in points { print(p) }").items().get(0);
        Expression init = initializerOf("let p: Point = Point { x: 1, y: 2 }");

        // Assert
        assertThat(loop.iterable()).isInstanceOf(Identifier.class);
        assertThat(init).isInstanceOf(StructInit.class);
        StructInit struct = (StructInit) init;
        assertThat(struct.name()).isEqualTo("Point");
        assertThat(struct.fields()).extracting(FieldInit::name).containsExactly("x", "y");
    }

    /**
     * Verifies that a brace in expression position is a dict literal and that
     * {@code Dict[K, V]} is parsed as a dict type annotation.
     */
    @Test
    @Tag("unit")
    void testDictLiteralAndDictType() {
        // Act
        VarDecl declaration = (VarDecl) parseProgram("let ages: Dict[str, int] = {\"ann\": 31, \"bob\": 27}").items().get(0);

        // Assert
        assertThat(declaration.type()).isInstanceOf(DictTypeRef.class);
        assertThat(declaration.type().display()).isEqualTo("Dict[str, int]");
        assertThat(declaration.initializer()).isInstanceOf(DictLiteral.class);
        assertThat(((DictLiteral) declaration.initializer()).entries()).hasSize(2);
    }

    /**
     * Verifies that list types nest and that an empty list literal is accepted.
     */
    @Test
    @Tag("unit")
    void testNestedListType() {
        // Act
        VarDecl declaration = (VarDecl) parseProgram("let grid: [[int]] = []").items().get(0);

        // Assert
        assertThat(declaration.type().display()).isEqualTo("[[int]]");
        assertThat(((ListLiteral) declaration.initializer()).elements()).isEmpty();
    }

    /**
     * Verifies that postfix operations chain from left to right.
     */
    @Test
    @Tag("unit")
    void testPostfixChain() {
        // Act
        Expression expression = parseExpression("names.join(\", \").upper()");
        Expression access = parseExpression("rows[0].cells[1]");

        // Assert
        assertThat(expression).isInstanceOf(MethodCall.class);
        MethodCall upper = (MethodCall) expression;
        assertThat(upper.method()).isEqualTo("upper");
        assertThat(upper.object()).isInstanceOf(MethodCall.class);
        assertThat(((MethodCall) upper.object()).arguments()).hasSize(1);

        assertThat(access).isInstanceOf(IndexExpr.class);
        assertThat(((IndexExpr) access).target()).isInstanceOf(MemberAccess.class);
    }

    /**
     * Verifies that a primitive type keyword followed by '(' is parsed as a cast call.
     */
    @Test
    @Tag("unit")
    void testCastIsParsedAsCall() {
        // Act
        Expression expression = initializerOf("let n: int = int(\"42\")");

        // Assert
        assertThat(expression).isInstanceOf(CallExpr.class);
        assertThat(((CallExpr) expression).callee()).isEqualTo("int");
        assertThat(((CallExpr) expression).arguments()).hasSize(1);
    }

    /**
     * Verifies that {@code else if} is represented as an else block holding a single nested if.
     */
    @Test
    @Tag("unit")
    void testElseIfIsWrappedInBlock() {
        // Act
        IfStmt statement = (IfStmt) parseProgram("if a { print(1) } else if b { print(2) } else { print(3) }").items().get(0);

        // Assert
        assertThat(statement.elseBlock()).isNotNull();
        assertThat(statement.elseBlock().statements()).hasSize(1);
        IfStmt nested = (IfStmt) statement.elseBlock().statements().get(0);
        assertThat(nested.elseBlock()).isNotNull();
    }

    /**
     * Verifies that print keeps positional arguments apart from the sep and end keyword arguments.
     */
    @Test
    @Tag("unit")
    void testPrintKeywordArguments() {
        // Act
        PrintStmt print = (PrintStmt) parseProgram("print(a, b, sep=\", \", end=\"\")").items().get(0);

        // Assert
        assertThat(print.arguments()).hasSize(2);
        assertThat(print.separator()).isInstanceOf(StringLiteral.class);
        assertThat(print.terminator()).isInstanceOf(StringLiteral.class);
    }

    /**
     * Verifies the three assignment forms.
     */
    @Test
    @Tag("unit")
    void testAssignmentTargets() {
        // Act
        List<Statement> items = parseProgram(String.join("\n",
                "x = 1",
                "xs[0] = 2",
                "p.x = 3")).items();

        // Assert
        assertThat(items.get(0)).isInstanceOf(AssignStmt.class);
        assertThat(((AssignStmt) items.get(0)).target()).isEqualTo("x");
        assertThat(items.get(1)).isInstanceOf(IndexAssignStmt.class);
        assertThat(items.get(2)).isInstanceOf(MemberAssignStmt.class);
    }

    /**
     * Verifies function, struct, enum and import declarations, including the binding name of a local import.
     */
    @Test
    @Tag("unit")
    void testDeclarations() {
        // Act
        List<Statement> items = parseProgram(String.join("\n",
                "fn add(a: int, b: int) -> int { return a + b }",
                "fn log(msg: str) -> void { print(msg) return }",
                "struct Point { x: int, y: int }",
                "enum Color { Red, Green, Blue }",
                "import math",
                "import \"./lib/util.qsr\"")).items();

        // Assert
        FnDecl add = (FnDecl) items.get(0);
        assertThat(add.params()).extracting(Param::name).containsExactly("a", "b");
        assertThat(add.returnType().display()).isEqualTo("int");

        FnDecl log = (FnDecl) items.get(1);
        assertThat(log.returnType().display()).isEqualTo("void");
        assertThat(((ReturnStmt) log.body().statements().get(1)).value()).isNull();

        assertThat(((StructDecl) items.get(2)).fields()).extracting(FieldDecl::name).containsExactly("x", "y");
        assertThat(((EnumDecl) items.get(3)).variants()).extracting(EnumVariant::name).containsExactly("Red", "Green", "Blue");

        ImportDecl module = (ImportDecl) items.get(4);
        assertThat(module.local()).isFalse();
        assertThat(module.bindingName()).isEqualTo("math");
        ImportDecl local = (ImportDecl) items.get(5);
        assertThat(local.local()).isTrue();
        assertThat(local.name()).isEqualTo("./lib/util.qsr");
        assertThat(local.bindingName()).isEqualTo("util");
    }

    /**
     * Verifies that every node's span contains the spans of its children.
     */
    @Test
    @Tag("unit")
    void testNodeSpansContainChildSpans() {
        // Arrange
        Program program = parseProgram(String.join("\n",
                "fn fib(n: int) -> int {",
                "    if n < 2 { return n }",
                "    return fib(n - 1) + fib(n - 2)",
                "}",
                "let xs: [int] = [1, 2, 3]",
                "for x in xs { print(\"{}\", x * 2, sep=\" \") }"));

        // Act & Assert
        assertSpansNested(program);
    }

    private void assertSpansNested(AstNode node) {
        Span outer = node.span();
        for (AstNode child : node.getChildren()) {
            assertThat(outer.contains(child.span()))
                    .as("%s should contain %s", node.getClass().getSimpleName(), child.getClass().getSimpleName())
                    .isTrue();
            assertSpansNested(child);
        }
    }

    /**
     * Verifies that a function without '->' is a syntax error and that the error renders
     * as {@code source:line:col: syntax error: message}.
     */
    @Test
    @Tag("unit")
    void testMissingArrowIsReported() {
        // Act
        SyntaxError error = parseError("fn f() int { return 1 }");

        // Assert
        assertThat(error.message()).isEqualTo("expected '->' after parameters");
        assertThat(error.display()).isEqualTo("main.qsr:1:8: syntax error: expected '->' after parameters");
    }

    /**
     * Verifies the syntax errors of malformed constructs.
     */
    @Test
    @Tag("unit")
    void testMalformedConstructsAreReported() {
        assertThat(parseError("let r: [int] = 0..5..10").message()).isEqualTo("range expressions cannot be chained");
        assertThat(parseError("handlers[0](1)").message()).isEqualTo("can only call functions");
        assertThat(parseError("1 = 2").message()).isEqualTo("invalid assignment target");
        assertThat(parseError("print()").message()).isEqualTo("print requires at least one argument");
        assertThat(parseError("print(a, sep=\"-\", sep=\"+\")").message()).isEqualTo("duplicate 'sep' argument");
        assertThat(parseError("enum Empty { }").message()).isEqualTo("enum must have at least one variant");
        assertThat(parseError("let x int = 1").message()).isEqualTo("expected ':' after variable name");
        assertThat(parseError("let x: int = ").message()).isEqualTo("expected expression");
    }

    /**
     * Verifies that the parser stops at the first error and reports exactly one diagnostic.
     */
    @Test
    @Tag("unit")
    void testOnlyFirstErrorIsReported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        parse("let a = 1\nlet b = 2", diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        assertThat(diagnostics.firstError().orElseThrow().code()).isEqualTo(SyntaxError.CODE);
    }

    /**
     * Verifies that a token list without END_OF_FILE is rejected.
     */
    @Test
    @Tag("unit")
    void testTokensMustEndWithEndOfFile() {
        // Arrange
        List<Token> tokens = new Lexer("x", new DiagnosticsEngine()).scanTokens();
        List<Token> truncated = tokens.subList(0, tokens.size() - 1);

        // Act & Assert
        assertThatThrownBy(() -> new Parser(truncated, new DiagnosticsEngine()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Verifies that an empty source parses to an empty program.
     */
    @Test
    @Tag("unit")
    void testEmptySource() {
        // Act
        Program program = parseProgram("# nothing here\n");

        // Assert
        assertThat(program.items()).isEmpty();
    }
}
