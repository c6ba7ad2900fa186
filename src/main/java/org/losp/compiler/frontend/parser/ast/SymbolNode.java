package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a symbol reference.
 *
 * @param token The symbol's token.
 */
public record SymbolNode(Token token) implements AstNode {

    public String name() {
        return token.text();
    }
}
