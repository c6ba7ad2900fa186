package org.losp.cli;

import org.losp.runtime.model.Value;
import org.losp.runtime.services.DisassemblyData;
import org.losp.runtime.spi.IExecutionObserver;
import org.losp.runtime.spi.TraceEvent;

import java.io.PrintWriter;
import java.util.stream.Collectors;

/**
 * Prints every instruction before it executes, one line each:
 * offset in hex, source line ({@code |} when unchanged), function, opcode,
 * operands and the operand stack.
 * <pre>
 * 0000     1 &lt;top&gt;      CONSTANT       0 '3.14159'         [ ]
 * 0003     | &lt;top&gt;      SET_GLOBAL     1 'pi'              [ 3.14159 ]
 * </pre>
 */
public class TracePrinter implements IExecutionObserver {

    private final PrintWriter out;
    private String lastFunction;
    private int lastLine = -1;

    public TracePrinter(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void beforeInstruction(TraceEvent event) {
        DisassemblyData instruction = event.instruction();
        boolean sameLine = event.functionName().equals(lastFunction) && instruction.line() == lastLine;
        lastFunction = event.functionName();
        lastLine = instruction.line();

        out.printf("%04x %5s %-10s %-14s %-18s [ %s ]%n",
                instruction.offset(),
                sameLine ? "|" : Integer.toString(instruction.line()),
                event.functionName(),
                instruction.opcode(),
                operands(instruction),
                event.stack().stream().map(Value::repr).collect(Collectors.joining(" ")));
        out.flush();
    }

    private static String operands(DisassemblyData instruction) {
        String text = instruction.operands().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" "));
        if (instruction.constant() != null) {
            text += " '" + instruction.constant() + "'";
        }
        return text;
    }
}
