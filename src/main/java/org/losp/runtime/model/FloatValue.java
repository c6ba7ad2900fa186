package org.losp.runtime.model;

import java.math.BigDecimal;

/**
 * A 64-bit IEEE 754 floating point number.
 * <p>
 * Equality is numeric, so {@code 0.0} equals {@code -0.0}, except that
 * {@code NaN} equals itself to keep equality reflexive.
 *
 * @param value The payload.
 */
public record FloatValue(double value) implements Value {

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FloatValue other)) {
            return false;
        }
        return value == other.value || (Double.isNaN(value) && Double.isNaN(other.value));
    }

    @Override
    public int hashCode() {
        // -0.0 hashes like 0.0
        return Double.hashCode(value == 0.0 ? 0.0 : value);
    }

    @Override
    public String typeName() {
        return "Float";
    }

    /**
     * Renders the number in plain decimal notation, always with a fractional part
     * ({@code 3.0}, {@code 0.1}, {@code 10000000000.0}).
     */
    @Override
    public String render() {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        String text = Double.toString(value);
        if (text.indexOf('E') < 0) {
            return text;
        }
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    @Override
    public boolean isTruthy() {
        return value != 0.0;
    }
}
