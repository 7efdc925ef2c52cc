package org.exprcalc.diagnostics;

import org.exprcalc.api.CalculationError;
import org.exprcalc.api.CalculatorErrorCode;

/**
 * Represents a single problem found while processing an expression.
 *
 * @param code The error kind.
 * @param message The diagnostic message.
 * @param column The 1-based column of the offending token, 0 if unknown.
 */
public record Diagnostic(
        CalculatorErrorCode code,
        String message,
        int column
) {
    /**
     * @return This diagnostic as a public API error.
     */
    public CalculationError toError() {
        return new CalculationError(code, message, column);
    }

    @Override
    public String toString() {
        return String.format("[%s] %d: %s", code, column, message);
    }
}
