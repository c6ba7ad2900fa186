package org.losp.runtime.isa;

/**
 * The instruction set of the losp virtual machine.
 * <p>
 * Every instruction is a one-byte opcode followed by its operand bytes. Two-byte
 * operands are unsigned and big-endian. Jump targets are absolute offsets into
 * the chunk that contains the jump.
 */
public enum OpCode {
    /** Pushes constant {@code u16} from the pool. */
    CONSTANT(2, 1),
    /** Pushes Nil. */
    NIL(0, 1),
    /** Discards the top of the stack. */
    POP(0, -1),
    /** Duplicates the top of the stack. */
    DUP(0, 1),
    /** Pushes frame slot {@code u16}. */
    GET_LOCAL(2, 1),
    /** Pushes the global named by string constant {@code u16}. */
    GET_GLOBAL(2, 1),
    /** Binds the global named by string constant {@code u16} to the top of the stack, leaving it there. */
    SET_GLOBAL(2, 0),
    /** Keeps the top value and drops every frame slot from {@code u16} upwards below it. */
    TRUNCATE(2, OpCode.VARIABLE),
    /** Continues at offset {@code u16}. */
    JUMP(2, 0),
    /** Pops the condition and continues at offset {@code u16} if it is falsy. */
    JUMP_IF_FALSE(2, -1),
    /** Calls the function below the top {@code u8} arguments. */
    CALL(1, OpCode.VARIABLE),
    /** Returns the top of the stack to the caller. */
    RETURN(0, -1),
    ADD(0, -1),
    SUBTRACT(0, -1),
    MULTIPLY(0, -1),
    DIVIDE(0, -1),
    NEGATE(0, 0),
    NOT(0, 0),
    EQUAL(0, -1),
    LESS(0, -1),
    GREATER(0, -1),
    /** Writes the rendering of the top of the stack and a newline, replacing it with Nil. */
    PRINT(0, 0);

    /** Marker for instructions whose stack effect depends on their operand. */
    public static final int VARIABLE = Integer.MIN_VALUE;

    private static final OpCode[] BY_CODE = values();

    private final int operandBytes;
    private final int stackEffect;

    OpCode(int operandBytes, int stackEffect) {
        this.operandBytes = operandBytes;
        this.stackEffect = stackEffect;
    }

    /**
     * @return The number of operand bytes following the opcode.
     */
    public int operandBytes() {
        return operandBytes;
    }

    /**
     * @return The total encoded length of the instruction.
     */
    public int length() {
        return 1 + operandBytes;
    }

    /**
     * @return The net change of the operand stack height, or {@link #VARIABLE}.
     */
    public int stackEffect() {
        return stackEffect;
    }

    /**
     * @return The byte this opcode is encoded as.
     */
    public byte code() {
        return (byte) ordinal();
    }

    /**
     * Decodes an opcode byte.
     * @param code The unsigned byte value.
     * @return The opcode.
     * @throws IllegalArgumentException if the byte is not a valid opcode.
     */
    public static OpCode fromByte(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown opcode: " + code);
        }
        return BY_CODE[code];
    }
}
