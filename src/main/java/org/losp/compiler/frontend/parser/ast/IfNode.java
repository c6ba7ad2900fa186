package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

/**
 * {@code (if condition then else)}.
 */
public record IfNode(Token token, AstNode condition, AstNode thenBranch, AstNode elseBranch) implements AstNode {
}
