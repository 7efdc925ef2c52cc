package org.exprcalc.registry;

import org.exprcalc.api.Value;
import org.exprcalc.frontend.Operator;

/**
 * The host operator set behind the expression operators.
 * <p>
 * Floor division and modulo are floored (the remainder takes the sign of the divisor).
 * Failures are signalled with {@link ArithmeticException}.
 */
public final class Arithmetic {

    private Arithmetic() {}

    /**
     * Applies a binary arithmetic or comparison operator.
     *
     * @param op The operator.
     * @param left The left operand.
     * @param right The right operand.
     * @return The result; comparisons produce booleans.
     * @throws ArithmeticException on division by zero or a result that is not a real number.
     */
    public static Value apply(Operator op, Value left, Value right) {
        double a = left.asNumber();
        double b = right.asNumber();
        return switch (op) {
            case PLUS -> Value.of(a + b);
            case MINUS -> Value.of(a - b);
            case MULTIPLY -> Value.of(a * b);
            case DIVIDE -> Value.of(divide(a, b));
            case FLOOR_DIVIDE -> Value.of(floorDivide(a, b));
            case MODULO -> Value.of(modulo(a, b));
            case POWER -> Value.of(power(a, b));
            case EQUAL -> Value.of(a == b);
            case NOT_EQUAL -> Value.of(a != b);
            case LESS -> Value.of(a < b);
            case GREATER -> Value.of(a > b);
            case LESS_EQUAL -> Value.of(a <= b);
            case GREATER_EQUAL -> Value.of(a >= b);
            case NEGATE -> throw new IllegalArgumentException("Unary operator applied to two operands: " + op);
        };
    }

    /**
     * @param operand The operand.
     * @return The negated operand as a number.
     */
    public static Value negate(Value operand) {
        return Value.of(-operand.asNumber());
    }

    public static double divide(double a, double b) {
        if (b == 0.0) {
            throw new ArithmeticException("float division by zero");
        }
        return a / b;
    }

    public static double floorDivide(double a, double b) {
        if (b == 0.0) {
            throw new ArithmeticException("float floor division by zero");
        }
        double mod = a % b;
        double div = (a - mod) / b;
        if (mod != 0.0 && (b < 0) != (mod < 0)) {
            div -= 1.0;
        }
        if (div == 0.0) {
            return Math.copySign(0.0, a / b);
        }
        double floor = Math.floor(div);
        if (div - floor > 0.5) {
            floor += 1.0;
        }
        return floor;
    }

    public static double modulo(double a, double b) {
        if (b == 0.0) {
            throw new ArithmeticException("float modulo by zero");
        }
        double mod = a % b;
        if (mod != 0.0) {
            if ((b < 0) != (mod < 0)) {
                mod += b;
            }
            return mod;
        }
        return Math.copySign(0.0, b);
    }

    public static double power(double base, double exponent) {
        if (exponent == 0.0 || base == 1.0) {
            return 1.0;
        }
        if (base == -1.0 && Double.isInfinite(exponent)) {
            return 1.0;
        }
        if (base == 0.0 && exponent < 0.0) {
            throw new ArithmeticException("0.0 cannot be raised to a negative power");
        }
        boolean finiteOperands = Double.isFinite(base) && Double.isFinite(exponent);
        if (finiteOperands && base < 0.0 && exponent != Math.rint(exponent)) {
            throw new ArithmeticException("negative number cannot be raised to a fractional power");
        }
        double result = Math.pow(base, exponent);
        if (finiteOperands && Double.isInfinite(result)) {
            throw new ArithmeticException("numerical result out of range");
        }
        return result;
    }
}
