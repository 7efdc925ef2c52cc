package org.exprcalc.api;

/**
 * The values an expression can produce. Booleans take part in arithmetic as {@code 1} and {@code 0}.
 */
public sealed interface Value permits Value.Num, Value.Bool {

    /**
     * @return The numeric view of this value.
     */
    double asNumber();

    /**
     * @return {@code true} if the value is non-zero.
     */
    boolean isTruthy();

    /**
     * Wraps a double.
     * @param value The number.
     * @return A numeric value.
     */
    static Value of(double value) {
        return new Num(value);
    }

    /**
     * Wraps a boolean.
     * @param value The boolean.
     * @return A boolean value.
     */
    static Value of(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    /**
     * A floating point number.
     * @param value The number.
     */
    record Num(double value) implements Value {
        @Override
        public double asNumber() {
            return value;
        }

        @Override
        public boolean isTruthy() {
            return value != 0.0;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * The result of a comparison or predicate function.
     * @param value The boolean.
     */
    record Bool(boolean value) implements Value {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public double asNumber() {
            return value ? 1.0 : 0.0;
        }

        @Override
        public boolean isTruthy() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }
}
