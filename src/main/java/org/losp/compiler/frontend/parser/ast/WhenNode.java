package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code (when condition body...)}. Evaluates to Nil when the condition is falsy.
 */
public record WhenNode(Token token, AstNode condition, List<AstNode> body) implements AstNode {

    public WhenNode {
        body = List.copyOf(body);
    }
}
