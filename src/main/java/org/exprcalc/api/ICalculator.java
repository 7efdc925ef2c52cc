package org.exprcalc.api;

/**
 * Defines the public, clean interface for the expression calculator.
 */
public interface ICalculator {

    /**
     * Calculates a single arithmetic or comparison expression.
     *
     * @param expression The expression, e.g. {@code "2*(3+4)"} or {@code "pi>=e"}.
     * @return The value on success, otherwise the first error that was found.
     */
    Calculation<Value> calculate(String expression);

    /**
     * Calculates the expression and reports failures as a checked exception.
     *
     * @param expression The expression.
     * @return The value of the expression.
     * @throws CalculationException if the expression cannot be calculated.
     */
    default Value evaluate(String expression) throws CalculationException {
        return calculate(expression).getOrThrow();
    }
}
