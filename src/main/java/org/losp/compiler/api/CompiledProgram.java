package org.losp.compiler.api;

import org.losp.runtime.model.Chunk;

import java.util.List;

/**
 * The result of compiling a whole source text: one top-level chunk per form, in
 * source order. Executing them in order on one VM runs the program.
 *
 * @param programName The name used for diagnostics.
 * @param chunks The top-level chunks.
 */
public record CompiledProgram(String programName, List<Chunk> chunks) {

    public CompiledProgram {
        chunks = List.copyOf(chunks);
    }
}
