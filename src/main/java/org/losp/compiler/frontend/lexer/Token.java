package org.losp.compiler.frontend.lexer;

import org.losp.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (e.g. the {@link Long} of an integer literal), or null.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The file or REPL entry name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of the token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * @param keyword The keyword to test for.
     * @return {@code true} if this token is the given keyword.
     */
    public boolean is(Keyword keyword) {
        return type == TokenType.KEYWORD && value == keyword;
    }
}
