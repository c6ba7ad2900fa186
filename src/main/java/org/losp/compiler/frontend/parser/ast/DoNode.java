package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code (do body...)}.
 */
public record DoNode(Token token, List<AstNode> body) implements AstNode {

    public DoNode {
        body = List.copyOf(body);
    }
}
