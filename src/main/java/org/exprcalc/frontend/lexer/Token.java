package org.exprcalc.frontend.lexer;

import org.exprcalc.frontend.Operator;

/**
 * Represents a single token extracted from an expression by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token.
 * @param value The processed value: a {@link Double} for numbers, an {@link Operator} for operators.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int column
) {
    /**
     * @return The operator this token stands for, or {@code null} if it is not an operator.
     */
    public Operator operator() {
        return value instanceof Operator op ? op : null;
    }

    /**
     * @param op The operator to compare with.
     * @return {@code true} if this token is the given operator.
     */
    public boolean is(Operator op) {
        return type == TokenType.OPERATOR && value == op;
    }

    @Override
    public String toString() {
        return text;
    }
}
