package org.exprcalc.registry;

import org.exprcalc.api.Value;

/**
 * The body of a registry function.
 */
@FunctionalInterface
public interface MathFunction {

    /**
     * Applies the function.
     *
     * @param args The arguments in call order; their count has already been checked against the arity.
     * @return The result.
     * @throws ArithmeticException if the arguments are outside the function's domain or the result overflows.
     */
    Value apply(double[] args);
}
