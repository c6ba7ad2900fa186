package org.losp.compiler.frontend.parser.ast;

import org.losp.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * One entry of a {@code let} binding list, either {@code (name init)} or a bare
 * {@code name} followed by its initializer. The parser records the shape as
 * written; a well-formed binding has a symbol target and exactly one initializer.
 *
 * @param token The first token of the binding.
 * @param target The bound name.
 * @param initializers The expressions following the name.
 */
public record LetBinding(Token token, AstNode target, List<AstNode> initializers) implements AstNode {

    public LetBinding {
        initializers = List.copyOf(initializers);
    }
}
