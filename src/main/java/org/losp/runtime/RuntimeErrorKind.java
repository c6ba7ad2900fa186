package org.losp.runtime;

/**
 * Classifies the errors that abort a VM run.
 */
public enum RuntimeErrorKind {
    /** An operand has the wrong type for arithmetic, comparison, negation or a call. */
    TYPE_MISMATCH,
    /** Integer division by zero or integer overflow. */
    ARITHMETIC,
    /** A function was called with a different number of arguments than it declares. */
    ARITY_MISMATCH,
    /** A global was read before anything was bound to its name. */
    UNRESOLVED_REFERENCE,
    /** The operand stack or the call-frame stack ran out of room. */
    STACK_EXHAUSTED
}
