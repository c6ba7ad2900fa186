package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code (while condition body...)}. Always evaluates to Nil.
 */
public record WhileNode(Token token, AstNode condition, List<AstNode> body) implements AstNode {

    public WhileNode {
        body = List.copyOf(body);
    }
}
