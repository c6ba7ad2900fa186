package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.api.SourceInfo;
import org.losp.compiler.frontend.lexer.Token;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST). The tree
 * is immutable; the compiler only reads it.
 */
public interface AstNode {

    /**
     * Returns the token that introduces the node: the atom itself for literals
     * and symbols, the keyword for special forms, the opening parenthesis for
     * applications.
     *
     * @return The introducing token.
     */
    Token token();

    /**
     * @return The position of the node in the source.
     */
    default SourceInfo sourceInfo() {
        return token().sourceInfo();
    }
}
