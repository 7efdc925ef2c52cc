package org.exprcalc.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Punctuation.
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The ',' character, separating function arguments. */
    COMMA,

    // Literals.
    /** A decimal literal such as {@code 12}, {@code .5} or {@code 1.5e3}. */
    NUMBER,
    /** Any other run of non-delimiter characters; resolved later as a constant or function name. */
    IDENTIFIER,

    /** An arithmetic or comparison operator, or the synthetic unary minus. */
    OPERATOR
}
