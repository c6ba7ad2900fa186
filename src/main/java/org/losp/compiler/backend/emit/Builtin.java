package org.losp.compiler.backend.emit;

import org.losp.runtime.isa.OpCode;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operators that compile straight to instructions when they appear in head
 * position and are not shadowed by a local.
 */
enum Builtin {
    ADD("+", 2, Integer.MAX_VALUE, OpCode.ADD),
    SUBTRACT("-", 1, Integer.MAX_VALUE, OpCode.SUBTRACT),
    MULTIPLY("*", 2, Integer.MAX_VALUE, OpCode.MULTIPLY),
    DIVIDE("/", 2, Integer.MAX_VALUE, OpCode.DIVIDE),
    EQUAL("=", 2, 2, OpCode.EQUAL),
    LESS("<", 2, 2, OpCode.LESS),
    GREATER(">", 2, 2, OpCode.GREATER),
    /** Emitted as GREATER followed by NOT. */
    LESS_EQUAL("<=", 2, 2, OpCode.GREATER),
    /** Emitted as LESS followed by NOT. */
    GREATER_EQUAL(">=", 2, 2, OpCode.LESS),
    NOT("not", 1, 1, OpCode.NOT),
    PRINT("print", 1, 1, OpCode.PRINT);

    private static final Map<String, Builtin> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Builtin::symbol, Function.identity()));

    private final String symbol;
    private final int minOperands;
    private final int maxOperands;
    private final OpCode opCode;

    Builtin(String symbol, int minOperands, int maxOperands, OpCode opCode) {
        this.symbol = symbol;
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
        this.opCode = opCode;
    }

    String symbol() {
        return symbol;
    }

    OpCode opCode() {
        return opCode;
    }

    boolean accepts(int operands) {
        return operands >= minOperands && operands <= maxOperands;
    }

    /**
     * Left-folding operators accept any number of operands from their minimum upwards.
     */
    boolean isVariadic() {
        return maxOperands == Integer.MAX_VALUE;
    }

    String describeOperandCount() {
        if (isVariadic()) {
            return "at least " + minOperands + " operand" + (minOperands == 1 ? "" : "s");
        }
        return "exactly " + minOperands + " operand" + (minOperands == 1 ? "" : "s");
    }

    static Optional<Builtin> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}
