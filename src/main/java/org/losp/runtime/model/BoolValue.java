package org.losp.runtime.model;

/**
 * A boolean value.
 *
 * @param value The payload.
 */
public record BoolValue(boolean value) implements Value {

    /** The {@code true} value. */
    public static final BoolValue TRUE = new BoolValue(true);
    /** The {@code false} value. */
    public static final BoolValue FALSE = new BoolValue(false);

    /**
     * Returns the shared instance for the given payload.
     * @param value The payload.
     * @return {@link #TRUE} or {@link #FALSE}.
     */
    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String typeName() {
        return "Bool";
    }

    @Override
    public String render() {
        return Boolean.toString(value);
    }

    @Override
    public boolean isTruthy() {
        return value;
    }
}
