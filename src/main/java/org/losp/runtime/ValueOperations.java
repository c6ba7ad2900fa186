package org.losp.runtime;

import org.losp.runtime.model.BoolValue;
import org.losp.runtime.model.FloatValue;
import org.losp.runtime.model.IntValue;
import org.losp.runtime.model.Value;

/**
 * The value semantics behind the arithmetic, comparison and equality instructions.
 * <p>
 * Arithmetic on two Ints stays Int. If either operand is a Float both are
 * widened to Float. Any other combination is a type mismatch. Equality never
 * widens.
 */
public final class ValueOperations {

    private ValueOperations() {}

    public static Value add(Value a, Value b) throws LospRuntimeException {
        if (a instanceof IntValue x && b instanceof IntValue y) {
            try {
                return new IntValue(Math.addExact(x.value(), y.value()));
            } catch (ArithmeticException e) {
                throw overflow("+", a, b);
            }
        }
        requireNumbers("add", a, b);
        return new FloatValue(toDouble(a) + toDouble(b));
    }

    public static Value subtract(Value a, Value b) throws LospRuntimeException {
        if (a instanceof IntValue x && b instanceof IntValue y) {
            try {
                return new IntValue(Math.subtractExact(x.value(), y.value()));
            } catch (ArithmeticException e) {
                throw overflow("-", a, b);
            }
        }
        requireNumbers("subtract", a, b);
        return new FloatValue(toDouble(a) - toDouble(b));
    }

    public static Value multiply(Value a, Value b) throws LospRuntimeException {
        if (a instanceof IntValue x && b instanceof IntValue y) {
            try {
                return new IntValue(Math.multiplyExact(x.value(), y.value()));
            } catch (ArithmeticException e) {
                throw overflow("*", a, b);
            }
        }
        requireNumbers("multiply", a, b);
        return new FloatValue(toDouble(a) * toDouble(b));
    }

    /**
     * Integer division truncates toward zero and rejects a zero divisor. Float
     * division follows IEEE 754, so dividing by {@code 0.0} yields an infinity or NaN.
     */
    public static Value divide(Value a, Value b) throws LospRuntimeException {
        if (a instanceof IntValue x && b instanceof IntValue y) {
            if (y.value() == 0) {
                throw new LospRuntimeException(RuntimeErrorKind.ARITHMETIC,
                        String.format("division by zero: (/ %s %s)", a.repr(), b.repr()));
            }
            if (x.value() == Long.MIN_VALUE && y.value() == -1) {
                throw overflow("/", a, b);
            }
            return new IntValue(x.value() / y.value());
        }
        requireNumbers("divide", a, b);
        return new FloatValue(toDouble(a) / toDouble(b));
    }

    public static Value negate(Value a) throws LospRuntimeException {
        if (a instanceof IntValue x) {
            if (x.value() == Long.MIN_VALUE) {
                throw new LospRuntimeException(RuntimeErrorKind.ARITHMETIC, "integer overflow: (- " + a.repr() + ")");
            }
            return new IntValue(-x.value());
        }
        if (a instanceof FloatValue x) {
            return new FloatValue(-x.value());
        }
        throw new LospRuntimeException(RuntimeErrorKind.TYPE_MISMATCH,
                String.format("cannot negate %s %s", a.typeName(), a.repr()));
    }

    public static BoolValue equal(Value a, Value b) {
        return BoolValue.of(a.equals(b));
    }

    public static BoolValue less(Value a, Value b) throws LospRuntimeException {
        if (a instanceof IntValue x && b instanceof IntValue y) {
            return BoolValue.of(x.value() < y.value());
        }
        requireNumbers("compare", a, b);
        return BoolValue.of(toDouble(a) < toDouble(b));
    }

    public static BoolValue greater(Value a, Value b) throws LospRuntimeException {
        if (a instanceof IntValue x && b instanceof IntValue y) {
            return BoolValue.of(x.value() > y.value());
        }
        requireNumbers("compare", a, b);
        return BoolValue.of(toDouble(a) > toDouble(b));
    }

    public static BoolValue not(Value a) {
        return BoolValue.of(!a.isTruthy());
    }

    private static boolean isNumber(Value v) {
        return v instanceof IntValue || v instanceof FloatValue;
    }

    private static void requireNumbers(String operation, Value a, Value b) throws LospRuntimeException {
        if (!isNumber(a) || !isNumber(b)) {
            throw new LospRuntimeException(RuntimeErrorKind.TYPE_MISMATCH,
                    String.format("cannot %s %s %s and %s %s", operation, a.typeName(), a.repr(), b.typeName(), b.repr()));
        }
    }

    private static double toDouble(Value v) {
        if (v instanceof IntValue i) {
            return i.value();
        }
        return ((FloatValue) v).value();
    }

    private static LospRuntimeException overflow(String operator, Value a, Value b) {
        return new LospRuntimeException(RuntimeErrorKind.ARITHMETIC,
                String.format("integer overflow: (%s %s %s)", operator, a.repr(), b.repr()));
    }
}
