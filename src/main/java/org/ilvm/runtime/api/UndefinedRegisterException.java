package org.ilvm.runtime.api;

/**
 * Thrown when an instruction reads a register that has never been written.
 * The accumulator is always defined and never causes this exception.
 */
public class UndefinedRegisterException extends ExecutionException {

    private final String registerName;

    /**
     * @param registerName The name of the register that was read.
     * @param programCounter The index of the failing instruction.
     * @param instruction The disassembled failing instruction.
     */
    public UndefinedRegisterException(String registerName, int programCounter, String instruction) {
        super("Undefined register: " + registerName, programCounter, instruction);
        this.registerName = registerName;
    }

    /**
     * @return The name of the register that was read.
     */
    public String getRegisterName() {
        return registerName;
    }
}
