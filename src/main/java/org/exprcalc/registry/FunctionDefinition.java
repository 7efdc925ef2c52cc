package org.exprcalc.registry;

/**
 * A named function with its arity policy.
 *
 * @param name The name used in expressions.
 * @param arity The accepted argument counts.
 * @param body The implementation.
 */
public record FunctionDefinition(String name, Arity arity, MathFunction body) {
}
