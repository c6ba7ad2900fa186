package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code (and operands...)} or {@code (or operands...)}. Short-circuits and
 * evaluates to the operand that decided the result.
 */
public record LogicalNode(Token token, Operator operator, List<AstNode> operands) implements AstNode {

    public enum Operator {
        AND,
        OR
    }

    public LogicalNode {
        operands = List.copyOf(operands);
    }
}
