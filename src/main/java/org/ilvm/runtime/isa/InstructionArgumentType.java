package org.ilvm.runtime.isa;

/**
 * Defines the semantic types of instruction operands.
 * The parser uses it to check the syntax of each operand token.
 */
public enum InstructionArgumentType {
    /** A decimal literal, a hexadecimal literal or a register name (e.g., 42, 16#FF, A). */
    EXPRESSION,
    /** The name of a register that is written (e.g., the target of ST, S, R). */
    VARIABLE,
    /** The name of a jump target. */
    LABEL
}
