package org.exprcalc.frontend.postfix;

import org.exprcalc.frontend.Operator;

/**
 * An entry on the converter's operator stack. Entries live only for one conversion.
 */
sealed interface OperatorStackEntry permits OperatorStackEntry.Pending, OperatorStackEntry.OpenParen, OperatorStackEntry.FunctionCall {

    /**
     * An operator waiting for its right operand.
     * @param operator The operator.
     * @param column The column of the operator token.
     */
    record Pending(Operator operator, int column) implements OperatorStackEntry {}

    /**
     * An unclosed '('.
     * @param column The column of the parenthesis.
     */
    record OpenParen(int column) implements OperatorStackEntry {}

    /**
     * A function call whose closing parenthesis has not been seen yet. The arity starts at one
     * and grows with every top-level separator inside the call.
     */
    final class FunctionCall implements OperatorStackEntry {
        private final String name;
        private final int column;
        private int arity = 1;

        FunctionCall(String name, int column) {
            this.name = name;
            this.column = column;
        }

        void addArgument() {
            arity++;
        }

        void markEmpty() {
            arity = 0;
        }

        RpnElement.Call close() {
            return new RpnElement.Call(name, arity, column);
        }

        String name() {
            return name;
        }

        int column() {
            return column;
        }
    }
}
