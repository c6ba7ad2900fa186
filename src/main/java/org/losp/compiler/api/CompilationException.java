package org.losp.compiler.api;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal structure of the compiler. An
 * exception raised for a single error carries its code and position; the summary thrown
 * by {@link ICompiler#compile(String, String)} carries those of the first error.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final SourceInfo sourceInfo;
    private final String detail;

    /**
     * Constructs a new compilation exception for a single error.
     * @param errorCode The error code.
     * @param detail The detail message, without position.
     * @param sourceInfo The source information.
     */
    public CompilationException(CompilerErrorCode errorCode, String detail, SourceInfo sourceInfo) {
        super(String.format("%s at %s", detail, sourceInfo));
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
        this.detail = detail;
    }

    /**
     * Constructs a summary exception.
     * @param message The full message.
     * @param first The first error, whose code and position are kept.
     */
    public CompilationException(String message, CompilationException first) {
        super(message, first);
        this.errorCode = first.errorCode;
        this.sourceInfo = first.sourceInfo;
        this.detail = first.detail;
    }

    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * @return The message without the position suffix.
     */
    public String getDetail() {
        return detail;
    }
}
