package org.quasar.compiler.frontend.lexer;

import org.quasar.compiler.diagnostics.CompilerLogger;
import org.quasar.compiler.diagnostics.DiagnosticsEngine;
import org.quasar.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine} and scanning continues with the
 * next character, so callers must check {@link DiagnosticsEngine#hasErrors()} afterwards.
 */
public class Lexer {

    /** Diagnostic code used for all scanning errors. */
    public static final String LEXICAL_ERROR = "lexical error";

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("let", TokenType.LET),
            Map.entry("const", TokenType.CONST),
            Map.entry("fn", TokenType.FN),
            Map.entry("return", TokenType.RETURN),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("in", TokenType.IN),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("print", TokenType.PRINT),
            Map.entry("struct", TokenType.STRUCT),
            Map.entry("enum", TokenType.ENUM),
            Map.entry("import", TokenType.IMPORT),
            Map.entry("sep", TokenType.SEP),
            Map.entry("end", TokenType.END),
            Map.entry("int", TokenType.INT),
            Map.entry("float", TokenType.FLOAT),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("str", TokenType.STR),
            Map.entry("void", TokenType.VOID)
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<stdin>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        int column = current - lineStart + 1;
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, Span.at(line, column, logicalFileName)));
        CompilerLogger.trace("Lexer: {} tokens from {}", tokens.size(), logicalFileName);
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '.': addToken(match('.') ? TokenType.DOT_DOT : TokenType.DOT); break;
            case '-': addToken(match('>') ? TokenType.ARROW : TokenType.MINUS); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (match('&')) {
                    addToken(TokenType.AND_AND);
                } else {
                    error("unexpected character '&' (did you mean '&&'?)");
                }
                break;
            case '|':
                if (match('|')) {
                    addToken(TokenType.OR_OR);
                } else {
                    error("unexpected character '|' (did you mean '||'?)");
                }
                break;
            case '"': string(); break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                line++;
                lineStart = current;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("unexpected character '" + c + "'");
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.TRUE) {
            addToken(type, Boolean.TRUE);
        } else if (type == TokenType.FALSE) {
            addToken(type, Boolean.FALSE);
        } else {
            addToken(type);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();
        // A dot only starts a fraction when a digit follows, so "0..10" stays a range.
        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek())) advance();
        }

        String numberString = source.substring(start, current);
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(numberString));
            } else {
                addToken(TokenType.INT_LITERAL, Long.parseLong(numberString));
            }
        } catch (NumberFormatException e) {
            error("invalid number literal '" + numberString + "'");
        }
    }

    private void string() {
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            advance();
        }

        if (peek() != '"') {
            error("unterminated string");
            return;
        }

        // The closing "
        advance();

        // The text of the token is the string *with* quotes, the value is the content.
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING_LITERAL, value);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, currentSpan()));
    }

    private Span currentSpan() {
        int startColumn = start - lineStart + 1;
        int endColumn = current - lineStart;
        return new Span(line, startColumn, line, Math.max(startColumn, endColumn), logicalFileName);
    }

    private void error(String message) {
        diagnostics.reportError(LEXICAL_ERROR, message, currentSpan());
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
