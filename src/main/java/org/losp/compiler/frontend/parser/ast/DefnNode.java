package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code (defn name (params...) body...)}. The name and the parameters are
 * checked to be distinct symbols by the compiler.
 *
 * @param token The {@code defn} keyword.
 * @param name The function name.
 * @param params The parameter list.
 * @param body The body expressions.
 */
public record DefnNode(Token token, AstNode name, List<AstNode> params, List<AstNode> body) implements AstNode {

    public DefnNode {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }
}
