package org.ilvm.runtime.api;

/**
 * Thrown when an instruction cannot be executed. The run that raised it is aborted;
 * the register table keeps the state it had before the failing instruction.
 * <p>
 * It is part of the public API. The concrete subclasses name the failure kind.
 */
public class ExecutionException extends Exception {

    private final int programCounter;
    private final String instruction;

    /**
     * Constructs a new execution exception.
     * @param message The detail message.
     * @param programCounter The index of the failing instruction.
     * @param instruction The disassembled failing instruction.
     */
    public ExecutionException(String message, int programCounter, String instruction) {
        super(String.format("%s (pc=%d, instruction='%s')", message, programCounter, instruction));
        this.programCounter = programCounter;
        this.instruction = instruction;
    }

    /**
     * Returns the index of the instruction that failed.
     * @return The program counter at the time of failure.
     */
    public int getProgramCounter() {
        return programCounter;
    }

    /**
     * Returns the failing instruction in its disassembled form.
     * @return The instruction text, e.g. {@code DIV 0}.
     */
    public String getInstruction() {
        return instruction;
    }
}
