package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;
import org.losp.runtime.model.Value;

/**
 * An AST node that represents a constant: a number, a string, {@code nil},
 * {@code true} or {@code false}.
 *
 * @param token The literal's token.
 * @param value The runtime value it denotes.
 */
public record LiteralNode(Token token, Value value) implements AstNode {
}
