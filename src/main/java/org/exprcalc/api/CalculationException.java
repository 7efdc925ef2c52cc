package org.exprcalc.api;

/**
 * Thrown by {@link ICalculator#evaluate(String)} when an expression cannot be calculated.
 * <p>
 * It is part of the public API and carries the {@link CalculationError} that caused it.
 */
public class CalculationException extends Exception {

    private final transient CalculationError error;

    /**
     * Constructs a new calculation exception for the given error.
     * @param error The error describing the failure.
     */
    public CalculationException(CalculationError error) {
        super(error.toString(), null);
        this.error = error;
    }

    /**
     * @return The error kind.
     */
    public CalculatorErrorCode getCode() {
        return error.code();
    }
}
