package org.exprcalc.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable lookup table of the constants and functions available to expressions.
 * Built once through a {@link Builder} and shared freely afterwards.
 */
public final class OperationRegistry {

    private final Map<String, Double> constants;
    private final Map<String, FunctionDefinition> functions;

    private OperationRegistry(Map<String, Double> constants, Map<String, FunctionDefinition> functions) {
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    /**
     * @param name The identifier.
     * @return The constant's value if {@code name} is a constant.
     */
    public Optional<Double> constant(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    /**
     * @param name The identifier.
     * @return The function if {@code name} is a function.
     */
    public Optional<FunctionDefinition> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean isFunction(String name) {
        return functions.containsKey(name);
    }

    public Set<String> constantNames() {
        return constants.keySet();
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects definitions before the registry is frozen. Later definitions replace earlier ones.
     */
    public static final class Builder {
        private final Map<String, Double> constants = new LinkedHashMap<>();
        private final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder constant(String name, double value) {
            constants.put(name, value);
            return this;
        }

        public Builder function(String name, Arity arity, MathFunction body) {
            functions.put(name, new FunctionDefinition(name, arity, body));
            return this;
        }

        public OperationRegistry build() {
            return new OperationRegistry(constants, functions);
        }
    }
}
