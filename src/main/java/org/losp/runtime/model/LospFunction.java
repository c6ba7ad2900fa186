package org.losp.runtime.model;

import java.util.Objects;

/**
 * A compiled function: a name, a declared parameter count and the chunk holding
 * its body. Functions capture nothing from the scope that defined them, so the
 * value is an immutable handle on its chunk.
 * <p>
 * Equality is identity.
 */
public final class LospFunction implements Value {

    private final String name;
    private final int arity;
    private final Chunk chunk;

    /**
     * Creates a new function value.
     * @param name The name given in {@code defn}.
     * @param arity The number of declared parameters.
     * @param chunk The compiled body.
     */
    public LospFunction(String name, int arity, Chunk chunk) {
        this.name = Objects.requireNonNull(name, "name");
        this.arity = arity;
        this.chunk = Objects.requireNonNull(chunk, "chunk");
    }

    public String name() {
        return name;
    }

    public int arity() {
        return arity;
    }

    public Chunk chunk() {
        return chunk;
    }

    @Override
    public String typeName() {
        return "Function";
    }

    @Override
    public String render() {
        return "fn<" + name + ">";
    }

    @Override
    public boolean isTruthy() {
        return true;
    }

    @Override
    public String toString() {
        return render() + "/" + arity;
    }
}
