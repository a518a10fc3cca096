package org.ilvm.runtime.api;

/**
 * Thrown when a jump targets a label that the program does not define.
 */
public class UndefinedLabelException extends ExecutionException {

    private final String label;

    /**
     * @param label The missing label.
     * @param programCounter The index of the failing jump.
     * @param instruction The disassembled failing jump.
     */
    public UndefinedLabelException(String label, int programCounter, String instruction) {
        super("Undefined label: " + label, programCounter, instruction);
        this.label = label;
    }

    /**
     * @return The missing label.
     */
    public String getLabel() {
        return label;
    }
}
