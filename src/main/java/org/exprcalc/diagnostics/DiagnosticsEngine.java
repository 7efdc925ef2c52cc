package org.exprcalc.diagnostics;

import org.exprcalc.api.CalculationError;
import org.exprcalc.api.CalculatorErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics reported by the pipeline stages of a single calculation.
 * <p>
 * This decouples error reporting from the stages themselves: a stage reports and stops,
 * the orchestrator checks {@link #hasErrors()} between phases. Not thread-safe; one
 * instance per calculation.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error kind.
     * @param message The error message.
     * @param column  The 1-based column of the offending token, 0 if unknown.
     */
    public void reportError(CalculatorErrorCode code, String message, int column) {
        diagnostics.add(new Diagnostic(code, message, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns the first reported error, which is the one surfaced to callers.
     *
     * @return The first error.
     * @throws IllegalStateException if nothing has been reported.
     */
    public CalculationError firstError() {
        if (diagnostics.isEmpty()) {
            throw new IllegalStateException("No errors have been reported");
        }
        return diagnostics.get(0).toError();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
