package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

/**
 * {@code (def target value)}. The target is checked to be a symbol by the compiler.
 *
 * @param token The {@code def} keyword.
 * @param target The name being defined.
 * @param value The value expression.
 */
public record DefNode(Token token, AstNode target, AstNode value) implements AstNode {
}
