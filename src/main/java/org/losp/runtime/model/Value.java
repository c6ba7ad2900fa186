package org.losp.runtime.model;

/**
 * The closed set of runtime values. Values flow on the operand stack, in the
 * constant pool of a {@link Chunk} and in global and local variable slots.
 * <p>
 * Equality is structural and never coerces: two values are equal only if they
 * are the same variant carrying the same payload, so {@code 1} and {@code 1.0}
 * are different values. Functions compare by identity.
 */
public sealed interface Value permits NilValue, BoolValue, IntValue, FloatValue, StringValue, LospFunction {

    /**
     * Returns the name of the variant, used in runtime error messages.
     * @return The type name, e.g. {@code "Int"}.
     */
    String typeName();

    /**
     * Renders the value the way {@code print} writes it.
     * @return The textual rendering.
     */
    String render();

    /**
     * Renders the value for diagnostic output (disassembly, traces). Differs from
     * {@link #render()} only where the plain rendering would be ambiguous.
     * @return The diagnostic rendering.
     */
    default String repr() {
        return render();
    }

    /**
     * Nil, {@code false}, integer zero, float zero and the empty string are falsy.
     * Everything else is truthy.
     * @return {@code true} if the value counts as true in a condition.
     */
    boolean isTruthy();
}
