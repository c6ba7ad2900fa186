package org.losp.runtime.services;

import org.losp.runtime.isa.OpCode;
import org.losp.runtime.model.Chunk;
import org.losp.runtime.model.LospFunction;
import org.losp.runtime.model.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the instruction stream of a {@link Chunk} into {@link DisassemblyData}.
 * Used by the debug trace and by tests that inspect compiler output. It only
 * reads the chunk.
 */
public class Disassembler {

    /**
     * Decodes the instruction starting at the given offset.
     *
     * @param chunk The chunk to read.
     * @param offset The offset of an opcode byte.
     * @return The decoded instruction.
     * @throws IllegalArgumentException if the offset does not hold a complete, valid instruction.
     */
    public DisassemblyData disassemble(Chunk chunk, int offset) {
        if (offset < 0 || offset >= chunk.size()) {
            throw new IllegalArgumentException("Offset " + offset + " outside chunk '" + chunk.name() + "' of size " + chunk.size());
        }
        OpCode opcode = OpCode.fromByte(chunk.byteAt(offset));
        if (offset + opcode.length() > chunk.size()) {
            throw new IllegalArgumentException("Truncated " + opcode + " at offset " + offset + " in chunk '" + chunk.name() + "'");
        }

        List<Integer> operands;
        switch (opcode.operandBytes()) {
            case 1 -> operands = List.of(chunk.byteAt(offset + 1));
            case 2 -> operands = List.of(chunk.u16At(offset + 1));
            default -> operands = List.of();
        }

        String constant = null;
        if (opcode == OpCode.CONSTANT || opcode == OpCode.GET_GLOBAL || opcode == OpCode.SET_GLOBAL) {
            int index = operands.get(0);
            constant = index < chunk.constants().size() ? chunk.constantAt(index).repr() : "<invalid constant " + index + ">";
        }
        return new DisassemblyData(offset, chunk.lineAt(offset), opcode, operands, constant);
    }

    /**
     * Decodes a whole chunk, in order.
     *
     * @param chunk The chunk to read.
     * @return All instructions of the chunk.
     */
    public List<DisassemblyData> disassemble(Chunk chunk) {
        List<DisassemblyData> instructions = new ArrayList<>();
        int offset = 0;
        while (offset < chunk.size()) {
            DisassemblyData data = disassemble(chunk, offset);
            instructions.add(data);
            offset = data.nextOffset();
        }
        return instructions;
    }

    /**
     * Collects the given chunk and, depth first, the chunks of every function in
     * its constant pool.
     *
     * @param chunk The root chunk.
     * @return The root chunk followed by all nested function chunks.
     */
    public List<Chunk> reachableChunks(Chunk chunk) {
        List<Chunk> chunks = new ArrayList<>();
        collect(chunk, chunks);
        return chunks;
    }

    private void collect(Chunk chunk, List<Chunk> into) {
        into.add(chunk);
        for (Value constant : chunk.constants()) {
            if (constant instanceof LospFunction function) {
                collect(function.chunk(), into);
            }
        }
    }
}
