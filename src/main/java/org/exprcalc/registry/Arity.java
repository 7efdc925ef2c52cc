package org.exprcalc.registry;

/**
 * The number of arguments a function accepts, as an inclusive range.
 *
 * @param min The smallest accepted argument count.
 * @param max The largest accepted argument count, {@link #UNBOUNDED} for no limit.
 */
public record Arity(int min, int max) {

    /** Marks a variadic upper bound. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public Arity {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid arity range " + min + ".." + max);
        }
    }

    /**
     * @param count The exact argument count.
     * @return An arity accepting only {@code count} arguments.
     */
    public static Arity fixed(int count) {
        return new Arity(count, count);
    }

    /**
     * @param min The smallest accepted count.
     * @param max The largest accepted count.
     * @return An arity accepting any count in {@code [min, max]}.
     */
    public static Arity range(int min, int max) {
        return new Arity(min, max);
    }

    /**
     * @param min The smallest accepted count.
     * @return An arity accepting {@code min} or more arguments.
     */
    public static Arity variadic(int min) {
        return new Arity(min, UNBOUNDED);
    }

    public boolean accepts(int count) {
        return count >= min && count <= max;
    }

    public boolean isFixed() {
        return min == max;
    }

    @Override
    public String toString() {
        if (isFixed()) {
            return Integer.toString(min);
        }
        if (max == UNBOUNDED) {
            return "at least " + min;
        }
        return min + " to " + max;
    }
}
