package org.exprcalc.frontend;

/**
 * The operators of the expression language together with their precedence and associativity.
 * <p>
 * Higher precedence binds tighter. Comparisons share the lowest tier, so a chain such as
 * {@code 1<2<3} is applied strictly left to right as nested binary comparisons.
 */
public enum Operator {
    EQUAL("==", 0, Kind.COMPARISON),
    NOT_EQUAL("!=", 0, Kind.COMPARISON),
    LESS_EQUAL("<=", 0, Kind.COMPARISON),
    GREATER_EQUAL(">=", 0, Kind.COMPARISON),
    LESS("<", 0, Kind.COMPARISON),
    GREATER(">", 0, Kind.COMPARISON),
    PLUS("+", 1, Kind.ARITHMETIC),
    MINUS("-", 1, Kind.ARITHMETIC),
    MULTIPLY("*", 2, Kind.ARITHMETIC),
    FLOOR_DIVIDE("//", 2, Kind.ARITHMETIC),
    DIVIDE("/", 2, Kind.ARITHMETIC),
    MODULO("%", 2, Kind.ARITHMETIC),
    POWER("^", 3, Kind.ARITHMETIC),
    /** Synthetic prefix minus, produced by the sign normalizer and never by the lexer. */
    NEGATE("-u", 4, Kind.UNARY);

    /**
     * The role an operator plays in conversion and evaluation.
     */
    public enum Kind {
        /** Binary arithmetic, placed by precedence. */
        ARITHMETIC,
        /** Binary comparison, yields a boolean. */
        COMPARISON,
        /** Prefix operator with a single operand. */
        UNARY
    }

    private static final Operator[] LEXABLE = {
            EQUAL, NOT_EQUAL, LESS_EQUAL, GREATER_EQUAL, FLOOR_DIVIDE,
            LESS, GREATER, PLUS, MINUS, MULTIPLY, DIVIDE, MODULO, POWER
    };

    private final String symbol;
    private final int precedence;
    private final Kind kind;

    Operator(String symbol, int precedence, Kind kind) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.kind = kind;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isComparison() {
        return kind == Kind.COMPARISON;
    }

    public boolean isUnary() {
        return kind == Kind.UNARY;
    }

    /**
     * Exponentiation and prefix negation group from the right, everything else from the left.
     * @return {@code true} for {@code ^} and the unary minus.
     */
    public boolean isRightAssociative() {
        return this == POWER || this == NEGATE;
    }

    /**
     * @return The number of operands the operator consumes.
     */
    public int operandCount() {
        return isUnary() ? 1 : 2;
    }

    /**
     * Finds the operator starting at the given position using longest match, so that
     * {@code //} wins over {@code /} and {@code <=} over {@code <}.
     *
     * @param source The text being scanned.
     * @param index The position to look at.
     * @return The operator, or {@code null} if no operator symbol starts there.
     */
    public static Operator matchAt(String source, int index) {
        for (Operator op : LEXABLE) {
            if (source.startsWith(op.symbol, index)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
