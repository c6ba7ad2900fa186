package org.losp.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A numeric literal with more than one dot, or digits mixed with other characters. */
    MALFORMED_NUMBER(Stage.LEX),
    /** A string literal that is not closed before the end of input. */
    UNTERMINATED_STRING(Stage.LEX),
    /** An integer literal that does not fit into 64 bits. */
    INTEGER_OUT_OF_RANGE(Stage.LEX),
    // endregion

    // region Parser Errors
    /** A token that cannot start or continue a form, such as a stray ')'. */
    UNEXPECTED_TOKEN(Stage.PARSE),
    /** The input ended inside an open form. */
    UNEXPECTED_END_OF_INPUT(Stage.PARSE),
    /** The empty list {@code ()}. */
    EMPTY_FORM(Stage.PARSE),
    /** A special form with the wrong number of sub-forms, e.g. {@code if} without an else branch. */
    INVALID_FORM_ARITY(Stage.PARSE),
    // endregion

    // region Compiler Errors
    /** A name position ({@code def} target, {@code defn} name or parameter) that does not hold a symbol. */
    EXPECTED_SYMBOL(Stage.COMPILE),
    /** A {@code let} binding that is not a symbol followed by exactly one initializer. */
    INVALID_LET_BINDING(Stage.COMPILE),
    /** A {@code defn} parameter list naming the same parameter twice. */
    DUPLICATE_PARAMETER(Stage.COMPILE),
    /** A built-in operator applied to the wrong number of operands. */
    INVALID_OPERAND_COUNT(Stage.COMPILE),
    /** A chunk needs more than 65535 constants. */
    TOO_MANY_CONSTANTS(Stage.COMPILE),
    /** A call passes, or a function declares, more than 255 arguments. */
    TOO_MANY_ARGUMENTS(Stage.COMPILE),
    /** A chunk grows beyond 65535 bytes of code, so jump targets no longer fit. */
    CHUNK_TOO_LARGE(Stage.COMPILE);
    // endregion

    /**
     * The pipeline stage that detects an error.
     */
    public enum Stage {
        LEX,
        PARSE,
        COMPILE
    }

    private final Stage stage;

    CompilerErrorCode(Stage stage) {
        this.stage = stage;
    }

    public Stage stage() {
        return stage;
    }
}
