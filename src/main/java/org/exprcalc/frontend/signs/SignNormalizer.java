package org.exprcalc.frontend.signs;

import org.exprcalc.frontend.Operator;
import org.exprcalc.frontend.lexer.Token;
import org.exprcalc.frontend.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses runs of consecutive {@code +} and {@code -} signs into a single sign and decides
 * whether that sign is unary or binary.
 * <p>
 * A run collapses to {@code -} when it holds an odd number of minus signs, otherwise to
 * {@code +}. A run at the start of the expression, or right after an operator, {@code (} or
 * {@code ,}, is unary: a minus becomes {@link Operator#NEGATE}, a plus disappears. Any
 * other run is an ordinary binary operator. After this pass the converter never sees two
 * adjacent signs.
 */
public class SignNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(SignNormalizer.class);

    private final List<Token> tokens;
    private final List<Token> output;
    private int minusCount = 0;
    private int signCount = 0;
    private int runColumn = 0;

    /**
     * Constructs a new SignNormalizer.
     * @param tokens The tokens produced by the lexer.
     */
    public SignNormalizer(List<Token> tokens) {
        this.tokens = tokens;
        this.output = new ArrayList<>(tokens.size());
    }

    /**
     * Runs the normalization in a single forward pass.
     * @return A new token list without sign runs.
     */
    public List<Token> normalize() {
        for (Token token : tokens) {
            if (token.is(Operator.PLUS) || token.is(Operator.MINUS)) {
                if (signCount == 0) {
                    runColumn = token.column();
                }
                signCount++;
                if (token.is(Operator.MINUS)) {
                    minusCount++;
                }
                continue;
            }
            if (signCount > 0) {
                resolveRun(false);
            }
            output.add(token);
        }
        if (signCount > 0) {
            resolveRun(true);
        }
        LOG.debug("Normalized {} tokens into {}", tokens.size(), output.size());
        return output;
    }

    /**
     * @param trailing {@code true} if nothing follows the run. Such a run is always kept,
     *                 so the missing operand is reported downstream instead of being hidden.
     */
    private void resolveRun(boolean trailing) {
        boolean negative = minusCount % 2 == 1;
        if (isUnaryPosition()) {
            if (negative) {
                output.add(new Token(TokenType.OPERATOR, "-", Operator.NEGATE, runColumn));
            } else if (trailing) {
                output.add(new Token(TokenType.OPERATOR, "+", Operator.PLUS, runColumn));
            }
        } else {
            Operator op = negative ? Operator.MINUS : Operator.PLUS;
            output.add(new Token(TokenType.OPERATOR, op.symbol(), op, runColumn));
        }
        if (trailing) {
            LOG.debug("Dangling sign run at column {}", runColumn);
        }
        signCount = 0;
        minusCount = 0;
    }

    private boolean isUnaryPosition() {
        if (output.isEmpty()) {
            return true;
        }
        TokenType previous = output.get(output.size() - 1).type();
        return previous == TokenType.OPERATOR
                || previous == TokenType.LEFT_PAREN
                || previous == TokenType.COMMA;
    }
}
