package org.exprcalc.api;

/**
 * A pure data class describing why an expression could not be calculated.
 *
 * @param code The error kind.
 * @param message A human readable description.
 * @param column The 1-based column of the offending token, or 0 if no single token is at fault.
 */
public record CalculationError(CalculatorErrorCode code, String message, int column) {

    @Override
    public String toString() {
        if (column > 0) {
            return String.format("%s at column %d", message, column);
        }
        return message;
    }
}
