package org.exprcalc.backend;

import org.exprcalc.api.CalculatorErrorCode;
import org.exprcalc.api.Value;
import org.exprcalc.diagnostics.DiagnosticsEngine;
import org.exprcalc.frontend.Operator;
import org.exprcalc.frontend.postfix.RpnElement;
import org.exprcalc.registry.Arithmetic;
import org.exprcalc.registry.FunctionDefinition;
import org.exprcalc.registry.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates a postfix stream with a single operand stack.
 * <p>
 * Operators and function calls pop their operands, the left-most operand being the deepest,
 * and push their result. The stream is valid only if exactly one value remains at the end.
 */
public class RpnEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RpnEvaluator.class);

    private final OperationRegistry registry;
    private final DiagnosticsEngine diagnostics;
    private final Deque<Value> stack = new ArrayDeque<>();

    /**
     * Constructs a new evaluator.
     * @param registry The registry the function calls are resolved against.
     * @param diagnostics The engine for reporting errors.
     */
    public RpnEvaluator(OperationRegistry registry, DiagnosticsEngine diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    /**
     * Evaluates the stream.
     * @param postfix The postfix stream.
     * @return The single resulting value, or {@code null} if an error was reported.
     */
    public Value evaluate(List<RpnElement> postfix) {
        for (RpnElement element : postfix) {
            boolean applied;
            if (element instanceof RpnElement.Literal literal) {
                stack.push(literal.value());
                applied = true;
            } else if (element instanceof RpnElement.Apply apply) {
                applied = applyOperator(apply);
            } else {
                applied = applyFunction((RpnElement.Call) element);
            }
            if (!applied) {
                return null;
            }
        }
        if (stack.size() != 1) {
            String message = stack.isEmpty()
                    ? "Expression does not produce a value"
                    : "Expression leaves " + stack.size() + " values, an operator is missing";
            diagnostics.reportError(CalculatorErrorCode.INVALID_FINAL_RESULT, message, 0);
            return null;
        }
        Value result = stack.pop();
        LOG.debug("Evaluated {} postfix elements to {}", postfix.size(), result);
        return result;
    }

    private boolean applyOperator(RpnElement.Apply apply) {
        Operator op = apply.operator();
        if (stack.size() < op.operandCount()) {
            diagnostics.reportError(CalculatorErrorCode.INVALID_FINAL_RESULT,
                    "Missing operand for '" + symbolOf(op) + "'", apply.column());
            return false;
        }
        try {
            if (op.isUnary()) {
                stack.push(Arithmetic.negate(stack.pop()));
            } else {
                Value right = stack.pop();
                Value left = stack.pop();
                stack.push(Arithmetic.apply(op, left, right));
            }
            return true;
        } catch (ArithmeticException e) {
            diagnostics.reportError(CalculatorErrorCode.OPERATION_FAILED,
                    "Operation '" + symbolOf(op) + "' failed: " + e.getMessage(), apply.column());
            return false;
        }
    }

    private boolean applyFunction(RpnElement.Call call) {
        Optional<FunctionDefinition> definition = registry.function(call.name());
        if (definition.isEmpty()) {
            diagnostics.reportError(CalculatorErrorCode.UNKNOWN_TOKEN,
                    "Unknown function '" + call.name() + "'", call.column());
            return false;
        }
        FunctionDefinition function = definition.get();
        if (!function.arity().accepts(call.arity())) {
            diagnostics.reportError(CalculatorErrorCode.INVALID_ARITY,
                    String.format("Function '%s' takes %s argument(s) but %d were given",
                            call.name(), function.arity(), call.arity()),
                    call.column());
            return false;
        }
        if (stack.size() < call.arity()) {
            diagnostics.reportError(CalculatorErrorCode.INVALID_FINAL_RESULT,
                    "Missing argument for '" + call.name() + "'", call.column());
            return false;
        }
        double[] args = new double[call.arity()];
        for (int i = args.length - 1; i >= 0; i--) {
            args[i] = stack.pop().asNumber();
        }
        try {
            stack.push(function.body().apply(args));
            return true;
        } catch (ArithmeticException | IllegalArgumentException e) {
            diagnostics.reportError(CalculatorErrorCode.OPERATION_FAILED,
                    "Function '" + call.name() + "' failed: " + e.getMessage(), call.column());
            return false;
        }
    }

    private static String symbolOf(Operator op) {
        return op.isUnary() ? "-" : op.symbol();
    }
}
