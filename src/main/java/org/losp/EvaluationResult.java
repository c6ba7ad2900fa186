package org.losp;

import org.losp.runtime.model.Value;

/**
 * The outcome of evaluating one top-level form interactively.
 *
 * @param value The form's value, or null if it failed.
 * @param error The {@link org.losp.compiler.api.CompilationException} or
 *              {@link org.losp.runtime.LospRuntimeException} that stopped it, or null.
 */
public record EvaluationResult(Value value, Exception error) {

    public static EvaluationResult success(Value value) {
        return new EvaluationResult(value, null);
    }

    public static EvaluationResult failure(Exception error) {
        return new EvaluationResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
