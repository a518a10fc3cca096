package org.ilvm.compiler.api;

/**
 * Thrown when a variable or label operand is not a valid identifier, e.g. {@code ST 5}.
 */
public class InvalidOperandException extends CompilationException {

    private final String operand;

    /**
     * @param mnemonic The instruction.
     * @param operand The offending operand.
     * @param expected A description of what was expected.
     * @param sourceInfo Where it was found.
     */
    public InvalidOperandException(String mnemonic, String operand, String expected, SourceInfo sourceInfo) {
        super(String.format("%s expects a %s but got '%s'", mnemonic, expected, operand), sourceInfo);
        this.operand = operand;
    }

    /**
     * @return The offending operand.
     */
    public String getOperand() {
        return operand;
    }
}
