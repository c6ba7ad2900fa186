package org.losp.runtime;

/**
 * Thrown when execution of a chunk fails. A runtime error is terminal for the
 * run that raised it; there is no recovery inside the language.
 */
public class LospRuntimeException extends Exception {

    private final RuntimeErrorKind kind;
    private final String detail;
    private final String functionName;
    private final int line;

    /**
     * Creates an error that has not been attributed to a source location yet.
     * @param kind The error classification.
     * @param detail The human readable description of what went wrong.
     */
    public LospRuntimeException(RuntimeErrorKind kind, String detail) {
        this(kind, detail, null, -1);
    }

    /**
     * Creates an error raised at a known location.
     * @param kind The error classification.
     * @param detail The human readable description of what went wrong.
     * @param functionName The function executing when the error occurred, or null.
     * @param line The source line of the failing instruction, or -1.
     */
    public LospRuntimeException(RuntimeErrorKind kind, String detail, String functionName, int line) {
        super(format(kind, detail, functionName, line));
        this.kind = kind;
        this.detail = detail;
        this.functionName = functionName;
        this.line = line;
    }

    /**
     * Returns a copy of this error attributed to the given location.
     * @param functionName The executing function.
     * @param line The source line of the failing instruction.
     * @return A new exception carrying the location.
     */
    public LospRuntimeException at(String functionName, int line) {
        LospRuntimeException located = new LospRuntimeException(kind, detail, functionName, line);
        located.setStackTrace(getStackTrace());
        return located;
    }

    public RuntimeErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }

    public String getFunctionName() {
        return functionName;
    }

    public int getLine() {
        return line;
    }

    private static String format(RuntimeErrorKind kind, String detail, String functionName, int line) {
        if (functionName == null) {
            return String.format("%s: %s", kind, detail);
        }
        return String.format("%s: %s [line %d in %s]", kind, detail, line, functionName);
    }
}
