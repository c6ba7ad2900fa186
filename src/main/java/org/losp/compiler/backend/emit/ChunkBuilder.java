package org.losp.compiler.backend.emit;

import org.losp.compiler.api.CompilationException;
import org.losp.compiler.api.CompilerErrorCode;
import org.losp.compiler.api.SourceInfo;
import org.losp.runtime.isa.OpCode;
import org.losp.runtime.model.Chunk;
import org.losp.runtime.model.FloatValue;
import org.losp.runtime.model.LospFunction;
import org.losp.runtime.model.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the code, line table and constant pool of one chunk while it is
 * being emitted.
 */
final class ChunkBuilder {

    /** Largest constant pool; indices must fit a u16 operand. */
    static final int MAX_CONSTANTS = 0xFFFF;
    /** Largest code size; every offset, jump targets included, must fit a u16 operand. */
    static final int MAX_CODE_SIZE = 0xFFFF;

    private final String name;
    private byte[] code = new byte[64];
    private int[] lines = new int[64];
    private int size = 0;
    private final List<Value> constants = new ArrayList<>();
    private final Map<Object, Integer> constantIndex = new HashMap<>();

    ChunkBuilder(String name) {
        this.name = name;
    }

    String name() {
        return name;
    }

    int size() {
        return size;
    }

    /**
     * Appends an instruction without operands.
     * @return The offset of the opcode.
     */
    int emit(OpCode op, SourceInfo at) throws CompilationException {
        int offset = size;
        append(op.code(), at);
        return offset;
    }

    /**
     * Appends an instruction with its operand, encoded as one or two bytes as the opcode requires.
     * @return The offset of the opcode.
     */
    int emit(OpCode op, int operand, SourceInfo at) throws CompilationException {
        int offset = emit(op, at);
        if (op.operandBytes() == 1) {
            append((byte) operand, at);
        } else {
            appendU16(operand, at);
        }
        return offset;
    }

    /**
     * Appends a forward jump with a placeholder target.
     * @return The offset of the operand, to be handed to {@link #patchJump(int, SourceInfo)}.
     */
    int emitJump(OpCode op, SourceInfo at) throws CompilationException {
        emit(op, at);
        int operandOffset = size;
        appendU16(0xFFFF, at);
        return operandOffset;
    }

    /**
     * Points the jump whose operand sits at {@code operandOffset} at the current end of the code.
     */
    void patchJump(int operandOffset, SourceInfo at) throws CompilationException {
        int target = size;
        if (target > MAX_CODE_SIZE) {
            throw tooLarge(at);
        }
        code[operandOffset] = (byte) (target >> 8);
        code[operandOffset + 1] = (byte) target;
    }

    /**
     * Adds a constant to the pool. Equal values share one slot; floats share only
     * when their bits match, so {@code 0.0} and {@code -0.0} stay apart. Functions
     * are never shared.
     * @return The pool index.
     */
    int addConstant(Value value, SourceInfo at) throws CompilationException {
        boolean internable = !(value instanceof LospFunction);
        Object key = value instanceof FloatValue f ? Double.doubleToRawLongBits(f.value()) : value;
        if (internable) {
            Integer existing = constantIndex.get(key);
            if (existing != null) {
                return existing;
            }
        }
        if (constants.size() >= MAX_CONSTANTS) {
            throw new CompilationException(CompilerErrorCode.TOO_MANY_CONSTANTS,
                    String.format("'%s' needs more than %d constants", name, MAX_CONSTANTS), at);
        }
        int index = constants.size();
        constants.add(value);
        if (internable) {
            constantIndex.put(key, index);
        }
        return index;
    }

    Chunk build() {
        return new Chunk(name, Arrays.copyOf(code, size), Arrays.copyOf(lines, size), constants);
    }

    private void appendU16(int value, SourceInfo at) throws CompilationException {
        append((byte) (value >> 8), at);
        append((byte) value, at);
    }

    private void append(byte b, SourceInfo at) throws CompilationException {
        if (size >= MAX_CODE_SIZE) {
            throw tooLarge(at);
        }
        if (size == code.length) {
            code = Arrays.copyOf(code, size * 2);
            lines = Arrays.copyOf(lines, size * 2);
        }
        code[size] = b;
        lines[size] = at.lineNumber();
        size++;
    }

    private CompilationException tooLarge(SourceInfo at) {
        return new CompilationException(CompilerErrorCode.CHUNK_TOO_LARGE,
                String.format("'%s' exceeds %d bytes of code", name, MAX_CODE_SIZE), at);
    }
}
