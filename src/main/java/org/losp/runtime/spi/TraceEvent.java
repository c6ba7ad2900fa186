package org.losp.runtime.spi;

import org.losp.runtime.model.Value;
import org.losp.runtime.services.DisassemblyData;

import java.util.List;

/**
 * A snapshot handed to an {@link IExecutionObserver}.
 *
 * @param functionName The function (or {@code <top>}) that owns the instruction.
 * @param frameDepth The number of active call frames, 1 for top-level code.
 * @param instruction The decoded instruction about to execute.
 * @param stack An immutable copy of the whole operand stack, bottom first.
 */
public record TraceEvent(
        String functionName,
        int frameDepth,
        DisassemblyData instruction,
        List<Value> stack
) {}
