package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code (let (bindings...) body...)}.
 *
 * @param token The {@code let} keyword.
 * @param bindings The bindings, evaluated in order.
 * @param body The body expressions; the last one is the value of the form.
 */
public record LetNode(Token token, List<LetBinding> bindings, List<AstNode> body) implements AstNode {

    public LetNode {
        bindings = List.copyOf(bindings);
        body = List.copyOf(body);
    }
}
