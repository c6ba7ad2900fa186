package org.losp.compiler.backend.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Compile-time bookkeeping for the function (or top-level form) being emitted:
 * the visible locals and the operand-stack height relative to the frame base.
 * <p>
 * A local's slot is the stack position its initializer's value ends up in, so
 * the slot numbering always agrees with the runtime frame layout. When a scope
 * closes its slots are truncated away and become free for later scopes.
 */
final class FunctionScope {

    record Local(String name, int slot, int depth) {}

    private final ChunkBuilder chunk;
    private final List<Local> locals = new ArrayList<>();
    private int scopeDepth = 0;
    private int stackDepth = 0;

    FunctionScope(ChunkBuilder chunk) {
        this.chunk = chunk;
    }

    ChunkBuilder chunk() {
        return chunk;
    }

    int stackDepth() {
        return stackDepth;
    }

    void setStackDepth(int stackDepth) {
        this.stackDepth = stackDepth;
    }

    void adjustStack(int delta) {
        this.stackDepth += delta;
    }

    void beginScope() {
        scopeDepth++;
    }

    /**
     * Closes the innermost scope and forgets its locals.
     * @return The lowest slot the scope declared, or empty if it declared none.
     */
    OptionalInt endScope() {
        OptionalInt lowest = OptionalInt.empty();
        while (!locals.isEmpty() && locals.get(locals.size() - 1).depth() == scopeDepth) {
            lowest = OptionalInt.of(locals.remove(locals.size() - 1).slot());
        }
        scopeDepth--;
        return lowest;
    }

    /**
     * Declares a local whose value is the one currently on top of the stack.
     * @return The slot of the new local.
     */
    int declareTop(String name) {
        int slot = stackDepth - 1;
        locals.add(new Local(name, slot, scopeDepth));
        return slot;
    }

    /**
     * Declares a parameter in the next slot and counts it as already on the stack.
     */
    void declareParameter(String name) {
        stackDepth++;
        declareTop(name);
    }

    /**
     * Finds the innermost local with the given name.
     * @return Its slot, or empty if the name is not a local of this function.
     */
    OptionalInt resolve(String name) {
        for (int i = locals.size() - 1; i >= 0; i--) {
            if (locals.get(i).name().equals(name)) {
                return OptionalInt.of(locals.get(i).slot());
            }
        }
        return OptionalInt.empty();
    }
}
