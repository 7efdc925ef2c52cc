package org.exprcalc.frontend.lexer;

import org.exprcalc.api.CalculatorErrorCode;
import org.exprcalc.diagnostics.DiagnosticsEngine;
import org.exprcalc.frontend.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The Lexer (also known as Tokenizer or Scanner) splits an expression into tokens.
 * <p>
 * Operators, parentheses, commas and whitespace are delimiters; every run of other
 * characters becomes a single {@link TokenType#NUMBER} or {@link TokenType#IDENTIFIER}
 * token. Whether an identifier actually names something is decided later.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    // '+' and '-' are always delimiters, so an exponent never carries a sign
    private static final Pattern DECIMAL = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE]\\d+)?");

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The expression as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source == null ? "" : source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire expression.
     * @return A list of the recognized tokens, empty if the expression was blank.
     */
    public List<Token> scanTokens() {
        if (source.isBlank()) {
            diagnostics.reportError(CalculatorErrorCode.EMPTY_EXPRESSION, "Empty expression", 0);
            return tokens;
        }
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        LOG.debug("Scanned {} tokens from '{}'", tokens.size(), source);
        return tokens;
    }

    private void scanToken() {
        char c = peek();
        switch (c) {
            case '(' -> addPunctuation(TokenType.LEFT_PAREN);
            case ')' -> addPunctuation(TokenType.RIGHT_PAREN);
            case ',' -> addPunctuation(TokenType.COMMA);
            default -> {
                if (Character.isWhitespace(c)) {
                    current++;
                    return;
                }
                Operator op = Operator.matchAt(source, current);
                if (op != null) {
                    current += op.symbol().length();
                    tokens.add(new Token(TokenType.OPERATOR, op.symbol(), op, start + 1));
                } else {
                    word();
                }
            }
        }
    }

    private void word() {
        while (!isAtEnd() && !isDelimiter(current)) current++;
        String text = source.substring(start, current);
        if (DECIMAL.matcher(text).matches()) {
            tokens.add(new Token(TokenType.NUMBER, text, Double.parseDouble(text), start + 1));
        } else {
            tokens.add(new Token(TokenType.IDENTIFIER, text, null, start + 1));
        }
    }

    private boolean isDelimiter(int index) {
        char c = source.charAt(index);
        return c == '(' || c == ')' || c == ','
                || Character.isWhitespace(c)
                || Operator.matchAt(source, index) != null;
    }

    private void addPunctuation(TokenType type) {
        current++;
        tokens.add(new Token(type, source.substring(start, current), null, start + 1));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return source.charAt(current);
    }
}
