package org.ilvm.runtime;

/**
 * Decides what happens when an operand is neither a literal nor a written register.
 */
public enum UnresolvedOperandPolicy {
    /** Abort the run with an execution exception. */
    FAIL,
    /** Log a warning and continue with the value 0. */
    ZERO
}
