package org.exprcalc.registry;

import org.exprcalc.api.Value;
import org.exprcalc.frontend.Operator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Arithmetic} operator set.
 */
@Tag("unit")
class ArithmeticTest {

    @ParameterizedTest
    @CsvSource({
            "5, 4, 1",
            "-5, 4, -2",
            "5, -4, -2",
            "-5, -4, 1",
            "7.5, 2, 3",
            "-0.5, 1, -1",
            "2.6666666666666665, 5, 0"
    })
    void floorDivisionRoundsTowardNegativeInfinity(double a, double b, double expected) {
        assertThat(Arithmetic.floorDivide(a, b)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "5, 4, 1",
            "-5, 4, 3",
            "5, -4, -3",
            "-5, -4, -1",
            "7.5, 2, 1.5",
            "4, 5, 4"
    })
    void moduloTakesTheSignOfTheDivisor(double a, double b, double expected) {
        assertThat(Arithmetic.modulo(a, b)).isEqualTo(expected);
    }

    @Test
    void divisionByZeroFails() {
        assertThatThrownBy(() -> Arithmetic.divide(1, 0)).isInstanceOf(ArithmeticException.class)
                .hasMessage("float division by zero");
        assertThatThrownBy(() -> Arithmetic.floorDivide(1, 0)).isInstanceOf(ArithmeticException.class)
                .hasMessage("float floor division by zero");
        assertThatThrownBy(() -> Arithmetic.modulo(1, 0)).isInstanceOf(ArithmeticException.class)
                .hasMessage("float modulo by zero");
    }

    @Test
    void powerHandlesOrdinaryCases() {
        assertThat(Arithmetic.power(2, 4)).isEqualTo(16.0);
        assertThat(Arithmetic.power(2, -3)).isEqualTo(0.125);
        assertThat(Arithmetic.power(-2, 3)).isEqualTo(-8.0);
        assertThat(Arithmetic.power(5, 0)).isEqualTo(1.0);
        assertThat(Arithmetic.power(1, Double.NaN)).isEqualTo(1.0);
        assertThat(Arithmetic.power(Double.NaN, 0)).isEqualTo(1.0);
        assertThat(Arithmetic.power(2, Double.POSITIVE_INFINITY)).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void powerRejectsResultsThatAreNotRealNumbers() {
        assertThatThrownBy(() -> Arithmetic.power(0, -1))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("negative power");
        assertThatThrownBy(() -> Arithmetic.power(-8, 0.5))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("fractional power");
        assertThatThrownBy(() -> Arithmetic.power(10, 400))
                .isInstanceOf(ArithmeticException.class)
                .hasMessage("numerical result out of range");
    }

    @Test
    void comparisonsProduceBooleans() {
        assertThat(Arithmetic.apply(Operator.LESS, Value.of(1), Value.of(2))).isEqualTo(Value.of(true));
        assertThat(Arithmetic.apply(Operator.GREATER_EQUAL, Value.of(1), Value.of(2))).isEqualTo(Value.of(false));
        assertThat(Arithmetic.apply(Operator.NOT_EQUAL, Value.of(Double.NaN), Value.of(Double.NaN)))
                .isEqualTo(Value.of(true));
    }

    @Test
    void booleansTakePartInArithmeticAsOneAndZero() {
        assertThat(Arithmetic.apply(Operator.PLUS, Value.of(true), Value.of(1))).isEqualTo(Value.of(2.0));
        assertThat(Arithmetic.apply(Operator.LESS, Value.of(true), Value.of(3))).isEqualTo(Value.of(true));
        assertThat(Arithmetic.negate(Value.of(true))).isEqualTo(Value.of(-1.0));
    }

    @Test
    void leftOperandIsTheFirstArgument() {
        assertThat(Arithmetic.apply(Operator.MINUS, Value.of(2), Value.of(3))).isEqualTo(Value.of(-1.0));
        assertThat(Arithmetic.apply(Operator.DIVIDE, Value.of(4), Value.of(5))).isEqualTo(Value.of(0.8));
    }

    @Test
    void negateIsNotABinaryOperator() {
        assertThatThrownBy(() -> Arithmetic.apply(Operator.NEGATE, Value.of(1), Value.of(2)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
