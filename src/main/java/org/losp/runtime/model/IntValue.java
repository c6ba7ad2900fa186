package org.losp.runtime.model;

/**
 * A 64-bit signed integer.
 *
 * @param value The payload.
 */
public record IntValue(long value) implements Value {

    @Override
    public String typeName() {
        return "Int";
    }

    @Override
    public String render() {
        return Long.toString(value);
    }

    @Override
    public boolean isTruthy() {
        return value != 0;
    }
}
