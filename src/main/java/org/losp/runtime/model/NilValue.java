package org.losp.runtime.model;

/**
 * The single Nil value.
 */
public enum NilValue implements Value {
    INSTANCE;

    @Override
    public String typeName() {
        return "Nil";
    }

    @Override
    public String render() {
        return "nil";
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public String toString() {
        return render();
    }
}
