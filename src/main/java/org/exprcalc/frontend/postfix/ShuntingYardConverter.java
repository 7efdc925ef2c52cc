package org.exprcalc.frontend.postfix;

import org.exprcalc.api.CalculatorErrorCode;
import org.exprcalc.api.Value;
import org.exprcalc.diagnostics.DiagnosticsEngine;
import org.exprcalc.frontend.Operator;
import org.exprcalc.frontend.lexer.Token;
import org.exprcalc.frontend.lexer.TokenType;
import org.exprcalc.registry.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Converts a sign-normalized token list from infix into postfix order (shunting-yard).
 * <p>
 * Constants are resolved to their values here, and every function call is closed with its
 * argument count, so the {@link org.exprcalc.backend.RpnEvaluator} can consume the stream
 * with a single stack. Conversion stops at the first structural error.
 */
public class ShuntingYardConverter {

    private static final Logger LOG = LoggerFactory.getLogger(ShuntingYardConverter.class);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final OperationRegistry registry;
    private final List<RpnElement> output = new ArrayList<>();
    private final Deque<OperatorStackEntry> stack = new ArrayDeque<>();
    private int current = 0;
    private boolean failed = false;

    /**
     * Constructs a new converter.
     * @param tokens The normalized tokens.
     * @param diagnostics The engine for reporting errors.
     * @param registry The constants and functions identifiers resolve against.
     */
    public ShuntingYardConverter(List<Token> tokens, DiagnosticsEngine diagnostics, OperationRegistry registry) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.registry = registry;
    }

    /**
     * Runs the conversion.
     * @return The postfix stream; incomplete if an error was reported.
     */
    public List<RpnElement> convert() {
        while (current < tokens.size() && !failed) {
            Token token = tokens.get(current);
            switch (token.type()) {
                case NUMBER -> output.add(new RpnElement.Literal(Value.of((Double) token.value()), token.column()));
                case IDENTIFIER -> identifier(token);
                case OPERATOR -> operator(token);
                case LEFT_PAREN -> stack.push(new OperatorStackEntry.OpenParen(token.column()));
                case RIGHT_PAREN -> closeParenthesis(token);
                case COMMA -> separator(token);
            }
            current++;
        }
        if (!failed) {
            drain();
        }
        LOG.debug("Converted {} tokens into {} postfix elements", tokens.size(), output.size());
        LOG.trace("Postfix: {}", output);
        return output;
    }

    private void identifier(Token token) {
        String name = token.text();
        Optional<Double> constant = registry.constant(name);
        if (constant.isPresent()) {
            output.add(new RpnElement.Literal(Value.of(constant.get()), token.column()));
        } else if (registry.isFunction(name)) {
            Token next = current + 1 < tokens.size() ? tokens.get(current + 1) : null;
            if (next == null || next.type() != TokenType.LEFT_PAREN) {
                error(CalculatorErrorCode.MISSING_FUNCTION_PAREN,
                        "Function '" + name + "' must be followed by '('", token.column());
                return;
            }
            stack.push(new OperatorStackEntry.FunctionCall(name, token.column()));
        } else {
            error(CalculatorErrorCode.UNKNOWN_TOKEN, "Unknown token '" + name + "'", token.column());
        }
    }

    private void operator(Token token) {
        Operator op = token.operator();
        if (op.isComparison()) {
            // comparisons share one tier: everything up to the enclosing group is complete
            popPendingOperators();
        } else {
            while (stack.peek() instanceof OperatorStackEntry.Pending pending && yieldsTo(pending.operator(), op)) {
                emit(pending);
                stack.pop();
            }
        }
        stack.push(new OperatorStackEntry.Pending(op, token.column()));
    }

    /**
     * @return {@code true} if {@code stacked} must be applied before {@code incoming} is pushed.
     */
    private static boolean yieldsTo(Operator stacked, Operator incoming) {
        if (incoming.isRightAssociative()) {
            return stacked.precedence() > incoming.precedence();
        }
        return stacked.precedence() >= incoming.precedence();
    }

    private void closeParenthesis(Token token) {
        popPendingOperators();
        if (!(stack.peek() instanceof OperatorStackEntry.OpenParen)) {
            error(CalculatorErrorCode.UNMATCHED_PARENTHESIS, "Unmatched ')'", token.column());
            return;
        }
        stack.pop();
        if (stack.peek() instanceof OperatorStackEntry.FunctionCall call) {
            TokenType previous = previousType();
            if (previous == TokenType.LEFT_PAREN) {
                call.markEmpty();
            } else if (previous == TokenType.COMMA) {
                error(CalculatorErrorCode.INVALID_ARITY,
                        "Empty argument in call to '" + call.name() + "'", token.column());
                return;
            }
            stack.pop();
            output.add(call.close());
        }
    }

    private void separator(Token token) {
        popPendingOperators();
        OperatorStackEntry.FunctionCall call = null;
        if (stack.peek() instanceof OperatorStackEntry.OpenParen) {
            for (OperatorStackEntry entry : stack) {
                if (entry instanceof OperatorStackEntry.FunctionCall candidate) {
                    call = candidate;
                    break;
                }
            }
        }
        if (call == null) {
            error(CalculatorErrorCode.UNMATCHED_PARENTHESIS, "Separator ',' outside of a function call", token.column());
            return;
        }
        TokenType previous = previousType();
        if (previous == TokenType.LEFT_PAREN || previous == TokenType.COMMA) {
            error(CalculatorErrorCode.INVALID_ARITY, "Empty argument in call to '" + call.name() + "'", token.column());
            return;
        }
        call.addArgument();
    }

    private void drain() {
        while (!stack.isEmpty()) {
            OperatorStackEntry entry = stack.pop();
            if (entry instanceof OperatorStackEntry.Pending pending) {
                emit(pending);
            } else if (entry instanceof OperatorStackEntry.OpenParen paren) {
                error(CalculatorErrorCode.UNMATCHED_PARENTHESIS, "Unclosed '('", paren.column());
                return;
            } else if (entry instanceof OperatorStackEntry.FunctionCall call) {
                error(CalculatorErrorCode.UNMATCHED_PARENTHESIS, "Unclosed call to '" + call.name() + "'", call.column());
                return;
            }
        }
    }

    private void popPendingOperators() {
        while (stack.peek() instanceof OperatorStackEntry.Pending pending) {
            emit(pending);
            stack.pop();
        }
    }

    private void emit(OperatorStackEntry.Pending pending) {
        output.add(new RpnElement.Apply(pending.operator(), pending.column()));
    }

    private TokenType previousType() {
        return current > 0 ? tokens.get(current - 1).type() : null;
    }

    private void error(CalculatorErrorCode code, String message, int column) {
        diagnostics.reportError(code, message, column);
        failed = true;
    }
}
