package org.losp.runtime.model;

/**
 * Bookkeeping for one active invocation: the chunk being executed, the
 * instruction pointer into it, and the operand-stack offset where the
 * invocation's slots begin. Slot {@code i} of the frame lives at
 * {@code base + i}; a called function's arguments occupy its first slots.
 */
public final class CallFrame {

    private final LospFunction function;
    private final Chunk chunk;
    private final int base;
    private int ip;

    /**
     * @param function The function being executed, or null for a top-level chunk.
     * @param chunk The chunk being executed.
     * @param base The stack offset of slot 0.
     */
    public CallFrame(LospFunction function, Chunk chunk, int base) {
        this.function = function;
        this.chunk = chunk;
        this.base = base;
        this.ip = 0;
    }

    public Chunk chunk() {
        return chunk;
    }

    public int base() {
        return base;
    }

    public int ip() {
        return ip;
    }

    public void jumpTo(int target) {
        this.ip = target;
    }

    /**
     * Reads one unsigned byte at the instruction pointer and advances past it.
     * @return The byte.
     */
    public int readByte() {
        return chunk.byteAt(ip++);
    }

    /**
     * Reads a 16-bit operand at the instruction pointer and advances past it.
     * @return The operand.
     */
    public int readU16() {
        int value = chunk.u16At(ip);
        ip += 2;
        return value;
    }

    /**
     * @return The name shown in error messages and traces.
     */
    public String displayName() {
        return function != null ? function.name() : chunk.name();
    }
}
