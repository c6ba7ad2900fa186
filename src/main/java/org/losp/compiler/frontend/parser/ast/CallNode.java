package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A function application, or a built-in operator when the callee is one of the
 * operator symbols.
 *
 * @param token The opening parenthesis.
 * @param callee The expression in head position.
 * @param arguments The argument expressions, evaluated left to right.
 */
public record CallNode(Token token, AstNode callee, List<AstNode> arguments) implements AstNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }
}
