package org.losp.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '(' character, opening a form. */
    LEFT_PAREN,
    /** The ')' character, closing a form. */
    RIGHT_PAREN,

    // Literals.
    /** An integer literal; the value is a {@link Long}. */
    INTEGER,
    /** A float literal; the value is a {@link Double}. */
    FLOAT,
    /** A string literal; the value is the text between the quotes. */
    STRING,
    /** Any other run of non-delimiter characters. */
    SYMBOL,

    // Keywords.
    /** A reserved word; the value is the {@link Keyword}. */
    KEYWORD,

    // Miscellaneous.
    /** A malformed token; the value is the {@link org.losp.compiler.api.CompilerErrorCode}. */
    ERROR,
    /** Represents the end of the source text. */
    END_OF_FILE
}
