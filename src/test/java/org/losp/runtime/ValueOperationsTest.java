package org.losp.runtime;

import org.losp.runtime.model.BoolValue;
import org.losp.runtime.model.FloatValue;
import org.losp.runtime.model.IntValue;
import org.losp.runtime.model.NilValue;
import org.losp.runtime.model.StringValue;
import org.losp.runtime.model.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ValueOperationsTest {

    private static IntValue i(long v) {
        return new IntValue(v);
    }

    private static FloatValue f(double v) {
        return new FloatValue(v);
    }

    private static RuntimeErrorKind kindOf(Throwable t) {
        return ((LospRuntimeException) t).getKind();
    }

    @Test
    @Tag("unit")
    void testIntArithmeticStaysInt() throws LospRuntimeException {
        assertThat(ValueOperations.add(i(2), i(3))).isEqualTo(i(5));
        assertThat(ValueOperations.subtract(i(2), i(3))).isEqualTo(i(-1));
        assertThat(ValueOperations.multiply(i(4), i(-3))).isEqualTo(i(-12));
        assertThat(ValueOperations.negate(i(4))).isEqualTo(i(-4));
    }

    @Test
    @Tag("unit")
    void testMixedArithmeticWidens() throws LospRuntimeException {
        assertThat(ValueOperations.add(i(1), f(0.1))).isEqualTo(f(1.1));
        assertThat(ValueOperations.multiply(f(1.5), i(2))).isEqualTo(f(3.0));
        assertThat(ValueOperations.divide(i(1), f(4.0))).isEqualTo(f(0.25));
    }

    @Test
    @Tag("unit")
    void testIntegerDivisionTruncatesTowardZero() throws LospRuntimeException {
        assertThat(ValueOperations.divide(i(7), i(2))).isEqualTo(i(3));
        assertThat(ValueOperations.divide(i(-7), i(2))).isEqualTo(i(-3));
    }

    @Test
    @Tag("unit")
    void testDivisionByZero() throws LospRuntimeException {
        assertThatThrownBy(() -> ValueOperations.divide(i(1), i(0)))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(RuntimeErrorKind.ARITHMETIC))
                .hasMessageContaining("division by zero");
        assertThat(ValueOperations.divide(f(1.0), f(0.0))).isEqualTo(f(Double.POSITIVE_INFINITY));
        assertThat(ValueOperations.divide(i(-1), f(0.0))).isEqualTo(f(Double.NEGATIVE_INFINITY));
    }

    @Test
    @Tag("unit")
    void testIntegerOverflowIsArithmeticError() {
        assertThatThrownBy(() -> ValueOperations.add(i(Long.MAX_VALUE), i(1)))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(RuntimeErrorKind.ARITHMETIC))
                .hasMessageContaining("integer overflow");
        assertThatThrownBy(() -> ValueOperations.multiply(i(Long.MAX_VALUE), i(2)))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(RuntimeErrorKind.ARITHMETIC));
        assertThatThrownBy(() -> ValueOperations.divide(i(Long.MIN_VALUE), i(-1)))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(RuntimeErrorKind.ARITHMETIC));
        assertThatThrownBy(() -> ValueOperations.negate(i(Long.MIN_VALUE)))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(RuntimeErrorKind.ARITHMETIC));
    }

    @Test
    @Tag("unit")
    void testNonNumbersAreTypeMismatch() {
        assertThatThrownBy(() -> ValueOperations.add(i(1), new StringValue("a")))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(RuntimeErrorKind.TYPE_MISMATCH))
                .hasMessageContaining("cannot add Int 1 and String \"a\"");
        assertThatThrownBy(() -> ValueOperations.less(NilValue.INSTANCE, i(1)))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(RuntimeErrorKind.TYPE_MISMATCH));
        assertThatThrownBy(() -> ValueOperations.negate(BoolValue.TRUE))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(RuntimeErrorKind.TYPE_MISMATCH));
    }

    @Test
    @Tag("unit")
    void testComparisonWidensButEqualityDoesNot() throws LospRuntimeException {
        assertThat(ValueOperations.less(i(1), f(1.5))).isEqualTo(BoolValue.TRUE);
        assertThat(ValueOperations.greater(f(2.5), i(3))).isEqualTo(BoolValue.FALSE);
        assertThat(ValueOperations.equal(i(1), f(1.0))).isEqualTo(BoolValue.FALSE);
        assertThat(ValueOperations.equal(i(1), i(1))).isEqualTo(BoolValue.TRUE);
        assertThat(ValueOperations.equal(f(0.0), f(-0.0))).isEqualTo(BoolValue.TRUE);
        assertThat(ValueOperations.equal(f(Double.NaN), f(Double.NaN))).isEqualTo(BoolValue.TRUE);
        assertThat(ValueOperations.equal(new StringValue("a"), new StringValue("a"))).isEqualTo(BoolValue.TRUE);
    }

    @Test
    @Tag("unit")
    void testNotFollowsTruthiness() {
        Value empty = new StringValue("");
        assertThat(ValueOperations.not(empty)).isEqualTo(BoolValue.TRUE);
        assertThat(ValueOperations.not(i(3))).isEqualTo(BoolValue.FALSE);
        assertThat(ValueOperations.not(NilValue.INSTANCE)).isEqualTo(BoolValue.TRUE);
    }
}
