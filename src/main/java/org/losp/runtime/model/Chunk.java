package org.losp.runtime.model;

import java.util.Arrays;
import java.util.List;

/**
 * A compiled unit: a flat instruction stream, the source line of every byte in
 * it, and the constant pool the instructions refer to. There is one chunk per
 * function body and one per top-level form. Chunks are immutable once built.
 */
public final class Chunk {

    private final String name;
    private final byte[] code;
    private final int[] lines;
    private final List<Value> constants;

    /**
     * Creates a chunk. The arrays are copied.
     * @param name The function name, or {@code <top>} for a top-level form.
     * @param code The encoded instructions.
     * @param lines The source line of each byte in {@code code}.
     * @param constants The constant pool.
     */
    public Chunk(String name, byte[] code, int[] lines, List<Value> constants) {
        if (code.length != lines.length) {
            throw new IllegalArgumentException("Line table does not match code length: " + lines.length + " != " + code.length);
        }
        this.name = name;
        this.code = code.clone();
        this.lines = lines.clone();
        this.constants = List.copyOf(constants);
    }

    public String name() {
        return name;
    }

    /**
     * @return The number of code bytes.
     */
    public int size() {
        return code.length;
    }

    /**
     * Reads one unsigned byte.
     * @param offset The offset into the code.
     * @return The byte value in {@code 0..255}.
     */
    public int byteAt(int offset) {
        return code[offset] & 0xFF;
    }

    /**
     * Reads an unsigned big-endian 16-bit operand.
     * @param offset The offset of the high byte.
     * @return The operand value in {@code 0..65535}.
     */
    public int u16At(int offset) {
        return (byteAt(offset) << 8) | byteAt(offset + 1);
    }

    /**
     * @param offset The offset into the code.
     * @return The source line that produced the byte at {@code offset}.
     */
    public int lineAt(int offset) {
        return lines[offset];
    }

    /**
     * @param index The pool index.
     * @return The constant at {@code index}.
     */
    public Value constantAt(int index) {
        return constants.get(index);
    }

    /**
     * @return The constant pool, unmodifiable.
     */
    public List<Value> constants() {
        return constants;
    }

    /**
     * @return A copy of the encoded instructions.
     */
    public byte[] code() {
        return code.clone();
    }

    @Override
    public String toString() {
        return "Chunk[" + name + ", " + code.length + " bytes, constants=" + constants + ", code=" + Arrays.toString(code) + "]";
    }
}
