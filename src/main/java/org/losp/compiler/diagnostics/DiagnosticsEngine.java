package org.losp.compiler.diagnostics;

import org.losp.compiler.api.CompilationException;
import org.losp.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one compilation so that the parser and the
 * emitter can keep going after an error and report everything at once.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<CompilationException> errors = new ArrayList<>();

    /**
     * Reports an error raised by a compiler stage.
     *
     * @param error The error.
     */
    public void reportError(CompilationException error) {
        SourceInfo at = error.getSourceInfo();
        errors.add(error);
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, error.getErrorCode(), error.getDetail(),
                at.fileName(), at.lineNumber(), at.columnNumber()));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param at The position the warning refers to.
     */
    public void reportWarning(String message, SourceInfo at) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, null, message,
                at.fileName(), at.lineNumber(), at.columnNumber()));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return An unmodifiable list of all collected diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return An unmodifiable list of the reported errors, in order.
     */
    public List<CompilationException> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
