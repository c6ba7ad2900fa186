package org.losp.runtime;

import org.losp.runtime.isa.OpCode;
import org.losp.runtime.model.CallFrame;
import org.losp.runtime.model.Chunk;
import org.losp.runtime.model.LospFunction;
import org.losp.runtime.model.NilValue;
import org.losp.runtime.model.Value;
import org.losp.runtime.services.Disassembler;
import org.losp.runtime.spi.IExecutionObserver;
import org.losp.runtime.spi.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The stack machine that executes compiled chunks.
 * <p>
 * A single operand stack is shared by all active frames; each frame owns the
 * contiguous range starting at its base offset. A call leaves the callee just
 * below its arguments, and the arguments become the callee's first slots
 * without copying. Returning collapses the frame's range, callee included, to
 * the single return value.
 * <p>
 * The global table belongs to the VM instance and survives across
 * {@link #execute(Chunk)} calls, so successive REPL entries see each other's
 * definitions. Operand and frame stacks are reset at the start and end of every
 * run. An instance is not thread-safe; concurrent programs need separate VMs.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final PrintWriter out;
    private final Map<String, Value> globals = new HashMap<>();
    private final Value[] stack;
    private final CallFrame[] frames;
    private final Disassembler disassembler = new Disassembler();
    private int sp = 0;
    private int frameCount = 0;
    private IExecutionObserver observer;

    /**
     * Creates a VM with default limits.
     * @param out The destination of {@code print}.
     */
    public VirtualMachine(PrintWriter out) {
        this(VmSettings.defaults(), out);
    }

    /**
     * Creates a VM.
     * @param settings The stack limits.
     * @param out The destination of {@code print}.
     */
    public VirtualMachine(VmSettings settings, PrintWriter out) {
        this.out = out;
        this.stack = new Value[settings.maxStack()];
        this.frames = new CallFrame[settings.maxFrames()];
    }

    /**
     * Installs or removes the instruction tap.
     * @param observer The observer to notify before each instruction, or null to disable tracing.
     */
    public void setObserver(IExecutionObserver observer) {
        this.observer = observer;
    }

    /**
     * Looks up a global.
     * @param name The global's name.
     * @return The bound value, or empty if nothing is bound to {@code name}.
     */
    public Optional<Value> getGlobal(String name) {
        return Optional.ofNullable(globals.get(name));
    }

    /**
     * Binds a global from the host side, overwriting any previous binding.
     * @param name The global's name.
     * @param value The value to bind.
     */
    public void defineGlobal(String name, Value value) {
        globals.put(name, value);
    }

    /**
     * @return An unmodifiable view of the global table.
     */
    public Map<String, Value> getGlobals() {
        return Collections.unmodifiableMap(globals);
    }

    /**
     * @return The number of values on the operand stack. Zero between runs.
     */
    public int getStackSize() {
        return sp;
    }

    /**
     * Runs a top-level chunk to completion.
     *
     * @param chunk The chunk to execute. It must end in {@link OpCode#RETURN}.
     * @return The value the chunk returned.
     * @throws LospRuntimeException if execution fails; the run is abandoned and the stacks are reset.
     */
    public Value execute(Chunk chunk) throws LospRuntimeException {
        resetStacks();
        LOG.debug("Executing chunk '{}' ({} bytes, {} constants)", chunk.name(), chunk.size(), chunk.constants().size());
        frames[frameCount++] = new CallFrame(null, chunk, 0);
        try {
            return run();
        } catch (LospRuntimeException e) {
            LOG.debug("Run of '{}' aborted: {}", chunk.name(), e.getMessage());
            throw e;
        } finally {
            resetStacks();
        }
    }

    private Value run() throws LospRuntimeException {
        CallFrame frame = frames[frameCount - 1];
        while (true) {
            int start = frame.ip();
            if (observer != null) {
                trace(frame, start);
            }
            OpCode op = OpCode.fromByte(frame.readByte());
            try {
                switch (op) {
                    case CONSTANT:
                        push(frame.chunk().constantAt(frame.readU16()));
                        break;
                    case NIL:
                        push(NilValue.INSTANCE);
                        break;
                    case POP:
                        pop();
                        break;
                    case DUP:
                        push(peek());
                        break;
                    case GET_LOCAL:
                        push(stack[frame.base() + frame.readU16()]);
                        break;
                    case GET_GLOBAL: {
                        String name = globalName(frame);
                        Value value = globals.get(name);
                        if (value == null) {
                            throw new LospRuntimeException(RuntimeErrorKind.UNRESOLVED_REFERENCE,
                                    "unresolved symbol '" + name + "'");
                        }
                        push(value);
                        break;
                    }
                    case SET_GLOBAL:
                        globals.put(globalName(frame), peek());
                        break;
                    case TRUNCATE: {
                        int slot = frame.readU16();
                        Value top = pop();
                        truncate(frame.base() + slot);
                        push(top);
                        break;
                    }
                    case JUMP:
                        frame.jumpTo(frame.readU16());
                        break;
                    case JUMP_IF_FALSE: {
                        int target = frame.readU16();
                        if (!pop().isTruthy()) {
                            frame.jumpTo(target);
                        }
                        break;
                    }
                    case CALL:
                        frame = call(frame.readByte());
                        break;
                    case RETURN: {
                        Value result = pop();
                        CallFrame finished = frames[--frameCount];
                        frames[frameCount] = null;
                        if (frameCount == 0) {
                            truncate(0);
                            return result;
                        }
                        // drop the callee together with its slots
                        truncate(finished.base() - 1);
                        push(result);
                        frame = frames[frameCount - 1];
                        break;
                    }
                    case ADD: {
                        Value b = pop();
                        push(ValueOperations.add(pop(), b));
                        break;
                    }
                    case SUBTRACT: {
                        Value b = pop();
                        push(ValueOperations.subtract(pop(), b));
                        break;
                    }
                    case MULTIPLY: {
                        Value b = pop();
                        push(ValueOperations.multiply(pop(), b));
                        break;
                    }
                    case DIVIDE: {
                        Value b = pop();
                        push(ValueOperations.divide(pop(), b));
                        break;
                    }
                    case NEGATE:
                        push(ValueOperations.negate(pop()));
                        break;
                    case NOT:
                        push(ValueOperations.not(pop()));
                        break;
                    case EQUAL: {
                        Value b = pop();
                        push(ValueOperations.equal(pop(), b));
                        break;
                    }
                    case LESS: {
                        Value b = pop();
                        push(ValueOperations.less(pop(), b));
                        break;
                    }
                    case GREATER: {
                        Value b = pop();
                        push(ValueOperations.greater(pop(), b));
                        break;
                    }
                    case PRINT:
                        out.println(pop().render());
                        out.flush();
                        push(NilValue.INSTANCE);
                        break;
                    default:
                        throw new IllegalStateException("Unhandled opcode " + op);
                }
            } catch (LospRuntimeException e) {
                if (e.getFunctionName() != null) {
                    throw e;
                }
                throw e.at(frame.displayName(), frame.chunk().lineAt(start));
            }
        }
    }

    private CallFrame call(int argCount) throws LospRuntimeException {
        Value callee = stack[sp - argCount - 1];
        if (!(callee instanceof LospFunction function)) {
            throw new LospRuntimeException(RuntimeErrorKind.TYPE_MISMATCH,
                    String.format("cannot call %s %s", callee.typeName(), callee.repr()));
        }
        if (function.arity() != argCount) {
            throw new LospRuntimeException(RuntimeErrorKind.ARITY_MISMATCH,
                    String.format("function '%s' expects %d argument%s but was given %d",
                            function.name(), function.arity(), function.arity() == 1 ? "" : "s", argCount));
        }
        if (frameCount == frames.length) {
            throw new LospRuntimeException(RuntimeErrorKind.STACK_EXHAUSTED,
                    String.format("call stack exhausted: more than %d nested calls", frames.length));
        }
        CallFrame frame = new CallFrame(function, function.chunk(), sp - argCount);
        frames[frameCount++] = frame;
        return frame;
    }

    private String globalName(CallFrame frame) {
        return frame.chunk().constantAt(frame.readU16()).render();
    }

    private void trace(CallFrame frame, int offset) {
        List<Value> snapshot = List.of(Arrays.copyOf(stack, sp));
        observer.beforeInstruction(new TraceEvent(frame.displayName(), frameCount,
                disassembler.disassemble(frame.chunk(), offset), snapshot));
    }

    private void push(Value value) throws LospRuntimeException {
        if (sp == stack.length) {
            throw new LospRuntimeException(RuntimeErrorKind.STACK_EXHAUSTED,
                    String.format("operand stack exhausted: more than %d values", stack.length));
        }
        stack[sp++] = value;
    }

    private Value pop() {
        Value value = stack[--sp];
        stack[sp] = null;
        return value;
    }

    private Value peek() {
        return stack[sp - 1];
    }

    private void truncate(int newSize) {
        Arrays.fill(stack, newSize, sp, null);
        sp = newSize;
    }

    private void resetStacks() {
        Arrays.fill(stack, 0, sp, null);
        sp = 0;
        Arrays.fill(frames, 0, frameCount, null);
        frameCount = 0;
    }
}
