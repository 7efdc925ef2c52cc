package org.exprcalc.registry;

import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.ArithmeticUtils;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.apache.commons.math3.util.FastMath;
import org.exprcalc.api.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;

/**
 * The built-in constants and functions, declared as an explicit table.
 * <p>
 * Results follow the usual libm conventions. A NaN produced from non-NaN arguments is
 * reported as a domain error, an infinity produced from finite arguments as a range error
 * (or a domain error for functions with a pole, such as {@code log(0)}).
 */
public final class StandardLibrary {

    private static final OperationRegistry REGISTRY = create();

    private static final String DOMAIN_ERROR = "math domain error";
    private static final String RANGE_ERROR = "math range error";
    private static final double ISCLOSE_RELATIVE_TOLERANCE = 1e-9;
    // 2^63, the first magnitude a long cannot hold
    private static final double LONG_LIMIT = 0x1p63;

    private StandardLibrary() {}

    /**
     * @return The shared registry with every built-in constant and function.
     */
    public static OperationRegistry registry() {
        return REGISTRY;
    }

    private static OperationRegistry create() {
        return OperationRegistry.builder()
                .constant("pi", Math.PI)
                .constant("e", Math.E)
                .constant("tau", 2 * Math.PI)
                .constant("inf", Double.POSITIVE_INFINITY)
                .constant("nan", Double.NaN)
                // trigonometry
                .function("sin", Arity.fixed(1), unary(Math::sin))
                .function("cos", Arity.fixed(1), unary(Math::cos))
                .function("tan", Arity.fixed(1), unary(Math::tan))
                .function("asin", Arity.fixed(1), unary(Math::asin))
                .function("acos", Arity.fixed(1), unary(Math::acos))
                .function("atan", Arity.fixed(1), unary(Math::atan))
                .function("atan2", Arity.fixed(2), binary(Math::atan2))
                .function("hypot", Arity.fixed(2), binary(Math::hypot))
                .function("degrees", Arity.fixed(1), unary(Math::toDegrees))
                .function("radians", Arity.fixed(1), unary(Math::toRadians))
                // hyperbolic
                .function("sinh", Arity.fixed(1), unary(Math::sinh))
                .function("cosh", Arity.fixed(1), unary(Math::cosh))
                .function("tanh", Arity.fixed(1), unary(Math::tanh))
                .function("asinh", Arity.fixed(1), unary(FastMath::asinh))
                .function("acosh", Arity.fixed(1), unary(FastMath::acosh))
                .function("atanh", Arity.fixed(1), pole(FastMath::atanh))
                // exponents and logarithms
                .function("exp", Arity.fixed(1), unary(Math::exp))
                .function("expm1", Arity.fixed(1), unary(Math::expm1))
                .function("log", Arity.range(1, 2), StandardLibrary::log)
                .function("log10", Arity.fixed(1), pole(Math::log10))
                .function("log1p", Arity.fixed(1), pole(Math::log1p))
                .function("log2", Arity.fixed(1), pole(StandardLibrary::log2))
                .function("sqrt", Arity.fixed(1), unary(Math::sqrt))
                .function("pow", Arity.fixed(2), binary(Arithmetic::power))
                .function("ldexp", Arity.fixed(2), StandardLibrary::ldexp)
                // number theory and representation
                .function("fabs", Arity.fixed(1), unary(Math::abs))
                .function("abs", Arity.fixed(1), unary(Math::abs))
                .function("copysign", Arity.fixed(2), binary(Math::copySign))
                .function("fmod", Arity.fixed(2), binary((a, b) -> a % b))
                .function("remainder", Arity.fixed(2), binary(Math::IEEEremainder))
                .function("ceil", Arity.fixed(1), integral("ceil", Math::ceil))
                .function("floor", Arity.fixed(1), integral("floor", Math::floor))
                .function("trunc", Arity.fixed(1), integral("trunc", x -> x < 0 ? Math.ceil(x) : Math.floor(x)))
                .function("round", Arity.range(1, 2), StandardLibrary::round)
                .function("factorial", Arity.fixed(1), StandardLibrary::factorial)
                .function("gcd", Arity.fixed(2), StandardLibrary::gcd)
                // special functions
                .function("erf", Arity.fixed(1), unary(Erf::erf))
                .function("erfc", Arity.fixed(1), unary(Erf::erfc))
                .function("gamma", Arity.fixed(1), unary(StandardLibrary::gamma))
                .function("lgamma", Arity.fixed(1), unary(StandardLibrary::lgamma))
                // classification
                .function("isfinite", Arity.fixed(1), predicate(Double::isFinite))
                .function("isinf", Arity.fixed(1), predicate(Double::isInfinite))
                .function("isnan", Arity.fixed(1), predicate(Double::isNaN))
                .function("isclose", Arity.fixed(2), StandardLibrary::isClose)
                .build();
    }

    // region Adapters
    private static MathFunction unary(DoubleUnaryOperator f) {
        return args -> Value.of(check(f.applyAsDouble(args[0]), RANGE_ERROR, args));
    }

    /**
     * For functions whose infinite results at finite arguments are poles, not overflows.
     */
    private static MathFunction pole(DoubleUnaryOperator f) {
        return args -> Value.of(check(f.applyAsDouble(args[0]), DOMAIN_ERROR, args));
    }

    private static MathFunction binary(DoubleBinaryOperator f) {
        return args -> Value.of(check(f.applyAsDouble(args[0], args[1]), RANGE_ERROR, args));
    }

    private static MathFunction predicate(DoublePredicate p) {
        return args -> Value.of(p.test(args[0]));
    }

    private static MathFunction integral(String name, DoubleUnaryOperator f) {
        return args -> Value.of(f.applyAsDouble(requireFinite(name, args[0])));
    }

    private static double check(double result, String infinityMessage, double... args) {
        if (Double.isNaN(result)) {
            for (double arg : args) {
                if (Double.isNaN(arg)) {
                    return result;
                }
            }
            throw new ArithmeticException(DOMAIN_ERROR);
        }
        if (Double.isInfinite(result)) {
            for (double arg : args) {
                if (Double.isInfinite(arg)) {
                    return result;
                }
            }
            throw new ArithmeticException(infinityMessage);
        }
        return result;
    }

    private static double requireFinite(String name, double x) {
        if (Double.isNaN(x)) {
            throw new ArithmeticException(name + "(): cannot convert float NaN to integer");
        }
        if (Double.isInfinite(x)) {
            throw new ArithmeticException(name + "(): cannot convert float infinity to integer");
        }
        return x;
    }

    /**
     * The cast saturates at the long range, so the result is only fit for comparison against
     * small bounds. {@link #gcd} needs the exact value and handles large magnitudes itself.
     */
    private static long requireIntegral(String name, double x) {
        if (x != Math.rint(x) || Double.isInfinite(x)) {
            throw new ArithmeticException(name + "() only accepts integral values");
        }
        return (long) x;
    }
    // endregion

    // region Implementations
    private static Value log(double[] args) {
        double x = args[0];
        if (x <= 0.0) {
            throw new ArithmeticException(DOMAIN_ERROR);
        }
        if (args.length == 1) {
            return Value.of(check(Math.log(x), DOMAIN_ERROR, x));
        }
        double base = args[1];
        if (base <= 0.0) {
            throw new ArithmeticException(DOMAIN_ERROR);
        }
        double denominator = Math.log(base);
        if (denominator == 0.0) {
            throw new ArithmeticException("float division by zero");
        }
        return Value.of(check(Math.log(x) / denominator, DOMAIN_ERROR, args));
    }

    private static double log2(double x) {
        if (x > 0.0 && Double.isFinite(x)) {
            int exponent = Math.getExponent(x);
            if (x == Math.scalb(1.0, exponent)) {
                return exponent;
            }
        }
        return Math.log(x) / Math.log(2.0);
    }

    private static Value ldexp(double[] args) {
        long exponent = requireIntegral("ldexp", args[1]);
        int clamped = (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, exponent));
        return Value.of(check(Math.scalb(args[0], clamped), RANGE_ERROR, args));
    }

    private static Value round(double[] args) {
        double x = args[0];
        if (args.length == 1) {
            return Value.of(Math.rint(requireFinite("round", x)));
        }
        long digits = requireIntegral("round", args[1]);
        if (!Double.isFinite(x)) {
            return Value.of(x);
        }
        if (digits > 400) {
            return Value.of(x);
        }
        if (digits < -400) {
            return Value.of(Math.copySign(0.0, x));
        }
        double rounded = new BigDecimal(x).setScale((int) digits, RoundingMode.HALF_EVEN).doubleValue();
        if (rounded == 0.0) {
            rounded = Math.copySign(0.0, x);
        }
        return Value.of(check(rounded, RANGE_ERROR, x));
    }

    private static Value factorial(double[] args) {
        long n = requireIntegral("factorial", args[0]);
        if (n < 0) {
            throw new ArithmeticException("factorial() not defined for negative values");
        }
        if (n <= 20) {
            return Value.of((double) CombinatoricsUtils.factorial((int) n));
        }
        if (n > 170) {
            throw new ArithmeticException("int too large to convert to float");
        }
        BigInteger product = BigInteger.valueOf(CombinatoricsUtils.factorial(20));
        for (long i = 21; i <= n; i++) {
            product = product.multiply(BigInteger.valueOf(i));
        }
        return Value.of(product.doubleValue());
    }

    private static Value gcd(double[] args) {
        double a = args[0];
        double b = args[1];
        requireIntegral("gcd", a);
        requireIntegral("gcd", b);
        if (Math.abs(a) < LONG_LIMIT && Math.abs(b) < LONG_LIMIT) {
            return Value.of((double) ArithmeticUtils.gcd((long) a, (long) b));
        }
        // beyond the long range every double is an exact (even) integer
        BigInteger gcd = new BigDecimal(a).toBigInteger().gcd(new BigDecimal(b).toBigInteger());
        return Value.of(gcd.doubleValue());
    }

    private static double gamma(double x) {
        if (x <= 0.0 && x == Math.rint(x)) {
            throw new ArithmeticException(DOMAIN_ERROR);
        }
        double result = Gamma.gamma(x);
        if (Double.isNaN(result) && x > 0.0) {
            // the Lanczos product degenerates to inf * 0 long after it has overflowed
            return Double.POSITIVE_INFINITY;
        }
        return result;
    }

    private static double lgamma(double x) {
        if (x <= 0.0 && x == Math.rint(x)) {
            throw new ArithmeticException(DOMAIN_ERROR);
        }
        if (x > 0.0) {
            return Gamma.logGamma(x);
        }
        // reflection formula for the negative non-integral axis
        return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - Gamma.logGamma(1.0 - x);
    }

    private static Value isClose(double[] args) {
        double a = args[0];
        double b = args[1];
        if (a == b) {
            return Value.of(true);
        }
        if (Double.isInfinite(a) || Double.isInfinite(b)) {
            return Value.of(false);
        }
        double diff = Math.abs(b - a);
        return Value.of(diff <= Math.abs(ISCLOSE_RELATIVE_TOLERANCE * b)
                || diff <= Math.abs(ISCLOSE_RELATIVE_TOLERANCE * a));
    }
    // endregion
}
