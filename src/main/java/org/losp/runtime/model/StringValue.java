package org.losp.runtime.model;

import java.util.Objects;

/**
 * An immutable string.
 *
 * @param value The payload, never null.
 */
public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String typeName() {
        return "String";
    }

    @Override
    public String render() {
        return value;
    }

    @Override
    public String repr() {
        return "\"" + value + "\"";
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }
}
