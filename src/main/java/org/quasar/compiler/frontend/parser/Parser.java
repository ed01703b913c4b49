package org.quasar.compiler.frontend.parser;

import org.quasar.compiler.diagnostics.CompilerLogger;
import org.quasar.compiler.diagnostics.DiagnosticsEngine;
import org.quasar.compiler.diagnostics.Span;
import org.quasar.compiler.frontend.lexer.Token;
import org.quasar.compiler.frontend.lexer.TokenType;
import org.quasar.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * The recursive-descent parser for quasar. It consumes a list of tokens
 * from the {@link org.quasar.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Expressions are parsed by precedence climbing, lowest to highest: range {@code ..},
 * {@code ||}, {@code &&}, equality, relational, additive, multiplicative, prefix {@code ! -},
 * then the postfix chain (call, index, member access, method call).
 * <p>
 * The parser stops at the first malformed construct. A parser instance is single-use and not thread-safe.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by an {@link TokenType#END_OF_FILE} token.
     * @param diagnostics The engine the syntax error is reported to.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token stream must end with END_OF_FILE.");
        }
        this.tokens = List.copyOf(tokens);
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The parsed {@link Program}, or the first {@link SyntaxError}.
     */
    public ParseResult parse() {
        try {
            List<Statement> items = new ArrayList<>();
            while (!isAtEnd()) {
                items.add(declaration());
            }
            Span span = items.isEmpty()
                    ? peek().span()
                    : Span.merge(items.get(0).span(), items.get(items.size() - 1).span());
            CompilerLogger.debug("Parser: {} top-level items in {}", items.size(), span.sourceId());
            return new ParseResult.Success(new Program(items, span));
        } catch (ParseAbort abort) {
            diagnostics.report(abort.error);
            CompilerLogger.debug("Parser: {}", abort.error.display());
            return new ParseResult.Failure(abort.error);
        }
    }

    // region Declarations

    private Statement declaration() {
        if (match(TokenType.LET)) return varDecl(previous());
        if (match(TokenType.CONST)) return constDecl(previous());
        if (match(TokenType.FN)) return fnDecl(previous());
        if (match(TokenType.STRUCT)) return structDecl(previous());
        if (match(TokenType.ENUM)) return enumDecl(previous());
        if (match(TokenType.IMPORT)) return importDecl(previous());
        return statement();
    }

    private VarDecl varDecl(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "expected variable name after 'let'");
        consume(TokenType.COLON, "expected ':' after variable name");
        TypeRef type = typeAnnotation();
        consume(TokenType.EQUAL, "expected '=' after type annotation");
        Expression initializer = expression();
        return new VarDecl(name.text(), type, initializer, Span.merge(keyword.span(), initializer.span()));
    }

    private ConstDecl constDecl(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "expected constant name after 'const'");
        consume(TokenType.COLON, "expected ':' after constant name");
        TypeRef type = typeAnnotation();
        consume(TokenType.EQUAL, "expected '=' after type annotation");
        Expression initializer = expression();
        return new ConstDecl(name.text(), type, initializer, Span.merge(keyword.span(), initializer.span()));
    }

    private FnDecl fnDecl(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "expected function name after 'fn'");
        consume(TokenType.LEFT_PAREN, "expected '(' after function name");
        List<Param> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token paramName = consume(TokenType.IDENTIFIER, "expected parameter name");
                consume(TokenType.COLON, "expected ':' after parameter name");
                TypeRef type = typeAnnotation();
                params.add(new Param(paramName.text(), type, Span.merge(paramName.span(), type.span())));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "expected ')' after parameters");
        consume(TokenType.ARROW, "expected '->' after parameters");
        TypeRef returnType = match(TokenType.VOID)
                ? new PrimitiveTypeRef(previous().text(), previous().span())
                : typeAnnotation();
        Block body = block();
        return new FnDecl(name.text(), params, returnType, body, Span.merge(keyword.span(), body.span()));
    }

    private StructDecl structDecl(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "expected struct name after 'struct'");
        consume(TokenType.LEFT_BRACE, "expected '{' after struct name");
        List<FieldDecl> fields = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            Token fieldName = consume(TokenType.IDENTIFIER, "expected field name");
            consume(TokenType.COLON, "expected ':' after field name");
            TypeRef type = typeAnnotation();
            fields.add(new FieldDecl(fieldName.text(), type, Span.merge(fieldName.span(), type.span())));
            if (!match(TokenType.COMMA)) break;
        }
        Token close = consume(TokenType.RIGHT_BRACE, "expected '}' after struct fields");
        return new StructDecl(name.text(), fields, Span.merge(keyword.span(), close.span()));
    }

    private EnumDecl enumDecl(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "expected enum name after 'enum'");
        consume(TokenType.LEFT_BRACE, "expected '{' after enum name");
        if (check(TokenType.RIGHT_BRACE)) {
            throw error(peek(), "enum must have at least one variant");
        }
        List<EnumVariant> variants = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            Token variant = consume(TokenType.IDENTIFIER, "expected variant name");
            variants.add(new EnumVariant(variant.text(), variant.span()));
            if (!match(TokenType.COMMA)) break;
        }
        Token close = consume(TokenType.RIGHT_BRACE, "expected '}' after enum variants");
        return new EnumDecl(name.text(), variants, Span.merge(keyword.span(), close.span()));
    }

    private ImportDecl importDecl(Token keyword) {
        if (match(TokenType.STRING_LITERAL)) {
            Token path = previous();
            return new ImportDecl((String) path.value(), true, Span.merge(keyword.span(), path.span()));
        }
        Token module = consume(TokenType.IDENTIFIER, "expected module name or path after 'import'");
        return new ImportDecl(module.text(), false, Span.merge(keyword.span(), module.span()));
    }

    private TypeRef typeAnnotation() {
        if (match(TokenType.LEFT_BRACKET)) {
            Token open = previous();
            TypeRef element = typeAnnotation();
            Token close = consume(TokenType.RIGHT_BRACKET, "expected ']' after list element type");
            return new ListTypeRef(element, Span.merge(open.span(), close.span()));
        }
        if (match(TokenType.INT, TokenType.FLOAT, TokenType.BOOL, TokenType.STR)) {
            return new PrimitiveTypeRef(previous().text(), previous().span());
        }
        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if ("Dict".equals(name.text()) && match(TokenType.LEFT_BRACKET)) {
                TypeRef key = typeAnnotation();
                consume(TokenType.COMMA, "expected ',' between dict key and value types");
                TypeRef value = typeAnnotation();
                Token close = consume(TokenType.RIGHT_BRACKET, "expected ']' after dict value type");
                return new DictTypeRef(key, value, Span.merge(name.span(), close.span()));
            }
            return new NamedTypeRef(name.text(), name.span());
        }
        throw error(peek(), "expected type name");
    }

    // endregion

    // region Statements

    private Statement statement() {
        if (match(TokenType.IF)) return ifStatement(previous());
        if (match(TokenType.WHILE)) return whileStatement(previous());
        if (match(TokenType.FOR)) return forStatement(previous());
        if (match(TokenType.RETURN)) return returnStatement(previous());
        if (match(TokenType.BREAK)) return new BreakStmt(previous().span());
        if (match(TokenType.CONTINUE)) return new ContinueStmt(previous().span());
        if (match(TokenType.PRINT)) return printStatement(previous());
        if (check(TokenType.LEFT_BRACE)) return block();
        return assignmentOrExpression();
    }

    private Block block() {
        Token open = consume(TokenType.LEFT_BRACE, "expected '{'");
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(declaration());
        }
        Token close = consume(TokenType.RIGHT_BRACE, "expected '}' after block");
        return new Block(statements, Span.merge(open.span(), close.span()));
    }

    private IfStmt ifStatement(Token keyword) {
        Expression condition = expression();
        Block thenBlock = block();
        Block elseBlock = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                IfStmt nested = ifStatement(previous());
                elseBlock = new Block(List.of(nested), nested.span());
            } else {
                elseBlock = block();
            }
        }
        Span end = elseBlock != null ? elseBlock.span() : thenBlock.span();
        return new IfStmt(condition, thenBlock, elseBlock, Span.merge(keyword.span(), end));
    }

    private WhileStmt whileStatement(Token keyword) {
        Expression condition = expression();
        Block body = block();
        return new WhileStmt(condition, body, Span.merge(keyword.span(), body.span()));
    }

    private ForStmt forStatement(Token keyword) {
        Token variable = consume(TokenType.IDENTIFIER, "expected loop variable after 'for'");
        consume(TokenType.IN, "expected 'in' after loop variable");
        Expression iterable = expression();
        Block body = block();
        return new ForStmt(variable.text(), iterable, body, Span.merge(keyword.span(), body.span()));
    }

    private ReturnStmt returnStatement(Token keyword) {
        // Statements have no terminator, so a bare return is only recognized right before '}'.
        if (check(TokenType.RIGHT_BRACE) || isAtEnd()) {
            return new ReturnStmt(null, keyword.span());
        }
        Expression value = expression();
        return new ReturnStmt(value, Span.merge(keyword.span(), value.span()));
    }

    private PrintStmt printStatement(Token keyword) {
        consume(TokenType.LEFT_PAREN, "expected '(' after 'print'");
        if (check(TokenType.SEP) || check(TokenType.END) || check(TokenType.RIGHT_PAREN)) {
            throw error(peek(), "print requires at least one argument");
        }
        List<Expression> arguments = new ArrayList<>();
        arguments.add(expression());
        Expression separator = null;
        Expression terminator = null;
        while (match(TokenType.COMMA)) {
            if (match(TokenType.SEP)) {
                if (separator != null) throw error(previous(), "duplicate 'sep' argument");
                consume(TokenType.EQUAL, "expected '=' after 'sep'");
                separator = expression();
            } else if (match(TokenType.END)) {
                if (terminator != null) throw error(previous(), "duplicate 'end' argument");
                consume(TokenType.EQUAL, "expected '=' after 'end'");
                terminator = expression();
            } else {
                arguments.add(expression());
            }
        }
        Token close = consume(TokenType.RIGHT_PAREN, "expected ')' after print arguments");
        return new PrintStmt(arguments, separator, terminator, Span.merge(keyword.span(), close.span()));
    }

    private Statement assignmentOrExpression() {
        Expression expression = expression();
        if (!match(TokenType.EQUAL)) {
            return new ExpressionStmt(expression, expression.span());
        }
        Token equals = previous();
        Expression value = expression();
        Span span = Span.merge(expression.span(), value.span());
        if (expression instanceof Identifier identifier) {
            return new AssignStmt(identifier.name(), identifier.span(), value, span);
        }
        if (expression instanceof IndexExpr index) {
            return new IndexAssignStmt(index, value, span);
        }
        if (expression instanceof MemberAccess member) {
            return new MemberAssignStmt(member, value, span);
        }
        throw error(equals, "invalid assignment target");
    }

    // endregion

    // region Expressions

    private Expression expression() {
        return range();
    }

    private Expression range() {
        Expression start = logicalOr();
        if (!match(TokenType.DOT_DOT)) {
            return start;
        }
        Expression end = logicalOr();
        if (check(TokenType.DOT_DOT)) {
            throw error(peek(), "range expressions cannot be chained");
        }
        return new RangeExpr(start, end, true, Span.merge(start.span(), end.span()));
    }

    private Expression logicalOr() {
        Expression expr = logicalAnd();
        while (match(TokenType.OR_OR)) {
            expr = binary(expr, BinaryOperator.OR, logicalAnd());
        }
        return expr;
    }

    private Expression logicalAnd() {
        Expression expr = equality();
        while (match(TokenType.AND_AND)) {
            expr = binary(expr, BinaryOperator.AND, equality());
        }
        return expr;
    }

    private Expression equality() {
        Expression expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            BinaryOperator operator = previous().type() == TokenType.EQUAL_EQUAL ? BinaryOperator.EQUAL : BinaryOperator.NOT_EQUAL;
            expr = binary(expr, operator, comparison());
        }
        return expr;
    }

    private Expression comparison() {
        Expression expr = term();
        while (match(TokenType.LESS, TokenType.GREATER, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL)) {
            BinaryOperator operator = switch (previous().type()) {
                case LESS -> BinaryOperator.LESS;
                case GREATER -> BinaryOperator.GREATER;
                case LESS_EQUAL -> BinaryOperator.LESS_EQUAL;
                default -> BinaryOperator.GREATER_EQUAL;
            };
            expr = binary(expr, operator, term());
        }
        return expr;
    }

    private Expression term() {
        Expression expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator operator = previous().type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            expr = binary(expr, operator, factor());
        }
        return expr;
    }

    private Expression factor() {
        Expression expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            BinaryOperator operator = switch (previous().type()) {
                case STAR -> BinaryOperator.MULTIPLY;
                case SLASH -> BinaryOperator.DIVIDE;
                default -> BinaryOperator.MODULO;
            };
            expr = binary(expr, operator, unary());
        }
        return expr;
    }

    private Expression unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token operatorToken = previous();
            UnaryOperator operator = operatorToken.type() == TokenType.BANG ? UnaryOperator.NOT : UnaryOperator.NEGATE;
            Expression operand = unary();
            return new UnaryExpr(operator, operand, Span.merge(operatorToken.span(), operand.span()));
        }
        return postfix();
    }

    private Expression postfix() {
        Expression expr = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                if (!(expr instanceof Identifier callee)) {
                    throw error(previous(), "can only call functions");
                }
                List<Expression> arguments = arguments();
                Token close = consume(TokenType.RIGHT_PAREN, "expected ')' after arguments");
                expr = new CallExpr(callee.name(), arguments, Span.merge(callee.span(), close.span()));
            } else if (match(TokenType.LEFT_BRACKET)) {
                Expression index = expression();
                Token close = consume(TokenType.RIGHT_BRACKET, "expected ']' after index");
                expr = new IndexExpr(expr, index, Span.merge(expr.span(), close.span()));
            } else if (match(TokenType.DOT)) {
                Token member = consume(TokenType.IDENTIFIER, "expected member name after '.'");
                if (match(TokenType.LEFT_PAREN)) {
                    List<Expression> arguments = arguments();
                    Token close = consume(TokenType.RIGHT_PAREN, "expected ')' after method arguments");
                    expr = new MethodCall(expr, member.text(), arguments, Span.merge(expr.span(), close.span()));
                } else {
                    expr = new MemberAccess(expr, member.text(), Span.merge(expr.span(), member.span()));
                }
            } else {
                return expr;
            }
        }
    }

    private List<Expression> arguments() {
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        return arguments;
    }

    private Expression primary() {
        if (match(TokenType.INT_LITERAL)) {
            return new IntLiteral((Long) previous().value(), previous().span());
        }
        if (match(TokenType.FLOAT_LITERAL)) {
            return new FloatLiteral((Double) previous().value(), previous().span());
        }
        if (match(TokenType.STRING_LITERAL)) {
            return new StringLiteral((String) previous().value(), previous().span());
        }
        if (match(TokenType.TRUE, TokenType.FALSE)) {
            return new BoolLiteral(previous().type() == TokenType.TRUE, previous().span());
        }
        // Casts: a type keyword directly followed by '(' is called like a function.
        if (peek().type().isPrimitiveTypeKeyword() && checkNext(TokenType.LEFT_PAREN)) {
            Token keyword = advance();
            return new Identifier(keyword.text(), keyword.span());
        }
        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (isStructInitAhead()) {
                return structInit(name);
            }
            return new Identifier(name.text(), name.span());
        }
        if (match(TokenType.LEFT_PAREN)) {
            Expression inner = expression();
            consume(TokenType.RIGHT_PAREN, "expected ')' after expression");
            return inner;
        }
        if (match(TokenType.LEFT_BRACKET)) {
            return listLiteral(previous());
        }
        if (match(TokenType.LEFT_BRACE)) {
            return dictLiteral(previous());
        }
        throw error(peek(), "expected expression");
    }

    /**
     * A '{' after an identifier starts a struct literal only for <code>{ IDENT :</code>,
     * so {@code for x in items { ... }} keeps its body block.
     */
    private boolean isStructInitAhead() {
        return check(TokenType.LEFT_BRACE)
                && checkAhead(1, TokenType.IDENTIFIER)
                && checkAhead(2, TokenType.COLON);
    }

    private StructInit structInit(Token name) {
        consume(TokenType.LEFT_BRACE, "expected '{' after struct name");
        List<FieldInit> fields = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            Token field = consume(TokenType.IDENTIFIER, "expected field name");
            consume(TokenType.COLON, "expected ':' after field name");
            Expression value = expression();
            fields.add(new FieldInit(field.text(), value, Span.merge(field.span(), value.span())));
            if (!match(TokenType.COMMA)) break;
        }
        Token close = consume(TokenType.RIGHT_BRACE, "expected '}' after struct fields");
        return new StructInit(name.text(), fields, Span.merge(name.span(), close.span()));
    }

    private ListLiteral listLiteral(Token open) {
        List<Expression> elements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET)) {
            elements.add(expression());
            if (!match(TokenType.COMMA)) break;
        }
        Token close = consume(TokenType.RIGHT_BRACKET, "expected ']' after list elements");
        return new ListLiteral(elements, Span.merge(open.span(), close.span()));
    }

    private DictLiteral dictLiteral(Token open) {
        List<DictEntry> entries = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            Expression key = expression();
            consume(TokenType.COLON, "expected ':' after dict key");
            Expression value = expression();
            entries.add(new DictEntry(key, value));
            if (!match(TokenType.COMMA)) break;
        }
        Token close = consume(TokenType.RIGHT_BRACE, "expected '}' after dict entries");
        return new DictLiteral(entries, Span.merge(open.span(), close.span()));
    }

    private Expression binary(Expression left, BinaryOperator operator, Expression right) {
        return new BinaryExpr(left, operator, right, Span.merge(left.span(), right.span()));
    }

    // endregion

    // region Token cursor

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        return checkAhead(1, type);
    }

    private boolean checkAhead(int distance, TokenType type) {
        int index = current + distance;
        if (index >= tokens.size()) return false;
        return tokens.get(index).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseAbort error(Token token, String message) {
        return new ParseAbort(new SyntaxError(message, token.span()));
    }

    // endregion

    /**
     * Unwinds the recursive descent to {@link #parse()}; never escapes this class.
     */
    private static final class ParseAbort extends RuntimeException {
        private final transient SyntaxError error;

        ParseAbort(SyntaxError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
