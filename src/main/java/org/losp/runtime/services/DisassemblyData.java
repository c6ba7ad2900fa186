package org.losp.runtime.services;

import org.losp.runtime.isa.OpCode;

import java.util.List;

/**
 * One decoded instruction.
 * @param offset The offset of the opcode byte in its chunk.
 * @param line The source line the instruction was compiled from.
 * @param opcode The opcode.
 * @param operands The decoded operands, empty for instructions without any.
 * @param constant The {@link org.losp.runtime.model.Value#repr() repr} of the referenced constant,
 *                 or null if the instruction does not reference the constant pool.
 */
public record DisassemblyData(
    int offset,
    int line,
    OpCode opcode,
    List<Integer> operands,
    String constant
) {

    public DisassemblyData {
        operands = List.copyOf(operands);
    }

    /**
     * @return The offset of the instruction following this one.
     */
    public int nextOffset() {
        return offset + opcode.length();
    }
}
