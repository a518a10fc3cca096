package org.ilvm.runtime.api;

/**
 * Thrown by {@code DIV} and {@code MOD} when the divisor evaluates to 0.
 */
public class DivisionByZeroException extends ExecutionException {

    /**
     * @param programCounter The index of the failing instruction.
     * @param instruction The disassembled failing instruction.
     */
    public DivisionByZeroException(int programCounter, String instruction) {
        super("Division by zero", programCounter, instruction);
    }
}
