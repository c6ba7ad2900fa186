package org.losp.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The reserved words of the language. They are lexed as {@link TokenType#KEYWORD}
 * tokens and can never name a variable.
 */
public enum Keyword {
    DEF("def"),
    LET("let"),
    IF("if"),
    WHEN("when"),
    DO("do"),
    DEFN("defn"),
    WHILE("while"),
    AND("and"),
    OR("or"),
    NIL("nil"),
    TRUE("true"),
    FALSE("false");

    private static final Map<String, Keyword> BY_TEXT = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Keyword::text, Function.identity()));

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * @param text A symbol-like run of characters.
     * @return The keyword spelled by {@code text}, if any.
     */
    public static Optional<Keyword> fromText(String text) {
        return Optional.ofNullable(BY_TEXT.get(text));
    }
}
