package org.exprcalc.api;

import java.util.Objects;

/**
 * The outcome of a calculation: either a value or exactly one error, never both.
 *
 * @param value The produced value, {@code null} on failure.
 * @param error The error, {@code null} on success.
 * @param <T> The type of the produced value.
 */
public record Calculation<T>(T value, CalculationError error) {

    /**
     * Creates a successful outcome.
     * @param value The produced value, must not be null.
     * @param <T> The type of the produced value.
     * @return The outcome.
     */
    public static <T> Calculation<T> success(T value) {
        return new Calculation<>(Objects.requireNonNull(value, "value"), null);
    }

    /**
     * Creates a failed outcome.
     * @param error The error, must not be null.
     * @param <T> The type the value would have had.
     * @return The outcome.
     */
    public static <T> Calculation<T> failure(CalculationError error) {
        return new Calculation<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * @return {@code true} if a value was produced.
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns the value or throws the error as a checked exception.
     * @return The produced value.
     * @throws CalculationException if this outcome is a failure.
     */
    public T getOrThrow() throws CalculationException {
        if (error != null) {
            throw new CalculationException(error);
        }
        return value;
    }
}
