package org.exprcalc.registry;

import org.exprcalc.api.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Contains unit tests for the functions and constants of the {@link StandardLibrary}.
 * The functions are called directly through their definitions, bypassing the parser.
 */
@Tag("unit")
class StandardLibraryTest {

    private static final OperationRegistry REGISTRY = StandardLibrary.registry();

    private static Value call(String name, double... args) {
        FunctionDefinition function = REGISTRY.function(name).orElseThrow();
        assertThat(function.arity().accepts(args.length)).as("arity of %s", name).isTrue();
        return function.body().apply(args);
    }

    private static double number(String name, double... args) {
        return call(name, args).asNumber();
    }

    @Test
    void constants() {
        assertThat(REGISTRY.constant("pi")).contains(Math.PI);
        assertThat(REGISTRY.constant("e")).contains(Math.E);
        assertThat(REGISTRY.constant("tau")).contains(2 * Math.PI);
        assertThat(REGISTRY.constant("inf")).contains(Double.POSITIVE_INFINITY);
        assertThat(REGISTRY.constant("nan").orElseThrow()).isNaN();
        assertThat(REGISTRY.constant("sin")).isEmpty();
    }

    @Test
    void aritiesMatchTheFunctionSignatures() {
        assertThat(REGISTRY.function("hypot").orElseThrow().arity()).isEqualTo(Arity.fixed(2));
        assertThat(REGISTRY.function("log").orElseThrow().arity()).isEqualTo(Arity.range(1, 2));
        assertThat(REGISTRY.function("round").orElseThrow().arity()).isEqualTo(Arity.range(1, 2));
        assertThat(REGISTRY.function("abs").orElseThrow().arity()).isEqualTo(Arity.fixed(1));
    }

    @Test
    void trigonometryDelegatesToTheHostMath() {
        assertThat(number("sin", 1)).isEqualTo(Math.sin(1));
        assertThat(number("atan2", 1, 2)).isEqualTo(Math.atan2(1, 2));
        assertThat(number("hypot", 3, 4)).isEqualTo(5.0);
        assertThat(number("degrees", Math.PI)).isCloseTo(180.0, within(1e-12));
    }

    @Test
    void logarithms() {
        assertThat(number("log", Math.E)).isCloseTo(1.0, within(1e-15));
        assertThat(number("log", 8, 2)).isCloseTo(3.0, within(1e-12));
        assertThat(number("log2", 8)).isEqualTo(3.0);
        assertThat(number("log2", 10)).isCloseTo(3.321928094887362, within(1e-12));
        assertThat(number("log10", 1000)).isEqualTo(3.0);
    }

    @Test
    void domainErrors() {
        assertThatThrownBy(() -> call("sqrt", -1)).hasMessage("math domain error");
        assertThatThrownBy(() -> call("log", 0)).hasMessage("math domain error");
        assertThatThrownBy(() -> call("log", 8, 1)).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> call("log10", 0)).hasMessage("math domain error");
        assertThatThrownBy(() -> call("acos", 2)).hasMessage("math domain error");
        assertThatThrownBy(() -> call("gamma", -2)).hasMessage("math domain error");
    }

    @Test
    void rangeErrors() {
        assertThatThrownBy(() -> call("exp", 1000)).hasMessage("math range error");
        assertThatThrownBy(() -> call("pow", 10, 400)).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void nonFiniteArgumentsPassThrough() {
        assertThat(number("exp", Double.POSITIVE_INFINITY)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(number("sqrt", Double.NaN)).isNaN();
    }

    @Test
    void rounding() {
        assertThat(number("round", 2.5)).isEqualTo(2.0);
        assertThat(number("round", 3.5)).isEqualTo(4.0);
        assertThat(number("round", 2.675, 2)).isEqualTo(2.67);
        assertThat(number("round", 1234, -2)).isEqualTo(1200.0);
        assertThat(number("trunc", -2.7)).isEqualTo(-2.0);
        assertThat(number("ceil", 1.2)).isEqualTo(2.0);
        assertThat(number("floor", -1.2)).isEqualTo(-2.0);
        assertThatThrownBy(() -> call("ceil", Double.POSITIVE_INFINITY))
                .hasMessageContaining("cannot convert float infinity");
        assertThatThrownBy(() -> call("round", 1.5, 0.5)).hasMessageContaining("integral");
    }

    @Test
    void integerFunctions() {
        assertThat(number("factorial", 5)).isEqualTo(120.0);
        assertThat(number("factorial", 0)).isEqualTo(1.0);
        assertThat(number("factorial", 25)).isEqualTo(new BigInteger("15511210043330985984000000").doubleValue());
        assertThat(number("gcd", 12, 18)).isEqualTo(6.0);
        assertThatThrownBy(() -> call("factorial", -1)).hasMessageContaining("negative");
        assertThatThrownBy(() -> call("factorial", 2.5)).hasMessageContaining("integral");
        assertThatThrownBy(() -> call("factorial", 171)).isInstanceOf(ArithmeticException.class);
    }

    /**
     * Doubles of magnitude 2^63 and above do not fit a long but are still exact integers.
     */
    @Test
    void gcdIsExactBeyondTheLongRange() {
        assertThat(number("gcd", 1e300, 2)).isEqualTo(2.0);
        assertThat(number("gcd", Math.pow(2, 70), 3 * Math.pow(2, 65))).isEqualTo(Math.pow(2, 65));
        assertThat(number("gcd", -Math.pow(2, 64), 6)).isEqualTo(2.0);
        assertThat(number("gcd", 0x1p63, 0)).isEqualTo(0x1p63);
        assertThatThrownBy(() -> call("gcd", Double.POSITIVE_INFINITY, 2)).hasMessageContaining("integral");
    }

    @Test
    void gammaOverflowIsARangeError() {
        assertThatThrownBy(() -> call("gamma", 200)).hasMessage("math range error");
        assertThatThrownBy(() -> call("gamma", 1000)).hasMessage("math range error");
        assertThatThrownBy(() -> call("lgamma", 1e308)).hasMessage("math range error");
        assertThatThrownBy(() -> call("gamma", 0)).hasMessage("math domain error");
        assertThatThrownBy(() -> call("lgamma", -3)).hasMessage("math domain error");
        assertThat(number("gamma", Double.POSITIVE_INFINITY)).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void specialFunctions() {
        assertThat(number("erf", 0)).isEqualTo(0.0);
        assertThat(number("erfc", 0)).isEqualTo(1.0);
        assertThat(number("gamma", 5)).isCloseTo(24.0, within(1e-9));
        assertThat(number("lgamma", 5)).isCloseTo(Math.log(24.0), within(1e-9));
        assertThat(number("lgamma", -0.5)).isCloseTo(1.2655121234846454, within(1e-9));
    }

    @Test
    void predicatesProduceBooleans() {
        assertThat(call("isnan", Double.NaN)).isEqualTo(Value.of(true));
        assertThat(call("isinf", 1)).isEqualTo(Value.of(false));
        assertThat(call("isfinite", 1)).isEqualTo(Value.of(true));
        assertThat(call("isclose", 0.1 + 0.2, 0.3)).isEqualTo(Value.of(true));
        assertThat(call("isclose", 1.0, 1.1)).isEqualTo(Value.of(false));
    }

    @Test
    void numericHelpers() {
        assertThat(number("fmod", -5, 4)).isEqualTo(-1.0);
        assertThat(number("copysign", 2, -0.0)).isEqualTo(-2.0);
        assertThat(number("ldexp", 3, 2)).isEqualTo(12.0);
        assertThat(number("abs", -3456)).isEqualTo(3456.0);
    }
}
