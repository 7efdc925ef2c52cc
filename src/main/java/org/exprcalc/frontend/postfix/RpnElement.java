package org.exprcalc.frontend.postfix;

import org.exprcalc.api.Value;
import org.exprcalc.frontend.Operator;

/**
 * One element of the postfix (reverse polish) stream produced by the {@link ShuntingYardConverter}.
 * <p>
 * Each element remembers the column of the token it came from, for error messages.
 */
public sealed interface RpnElement permits RpnElement.Literal, RpnElement.Apply, RpnElement.Call {

    /**
     * @return The 1-based column of the originating token.
     */
    int column();

    /**
     * A number, either written literally or resolved from a named constant.
     * @param value The value.
     * @param column The column of the originating token.
     */
    record Literal(Value value, int column) implements RpnElement {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * An operator application, unary or binary.
     * @param operator The operator.
     * @param column The column of the operator token.
     */
    record Apply(Operator operator, int column) implements RpnElement {
        @Override
        public String toString() {
            return operator.symbol();
        }
    }

    /**
     * A function call consuming {@code arity} operands.
     * @param name The function name.
     * @param arity The number of arguments written in the call.
     * @param column The column of the function name.
     */
    record Call(String name, int arity, int column) implements RpnElement {
        @Override
        public String toString() {
            return name + "/" + arity;
        }
    }
}
