package org.ilvm.runtime.api;

/**
 * Thrown when an operand token is neither a decimal literal, a hexadecimal literal
 * nor a register name, e.g. {@code 16#XZ} or {@code 12ab}.
 */
public class UnknownExpressionException extends ExecutionException {

    private final String token;

    /**
     * @param token The offending operand token.
     * @param programCounter The index of the failing instruction.
     * @param instruction The disassembled failing instruction.
     */
    public UnknownExpressionException(String token, int programCounter, String instruction) {
        super("Unknown expression: " + token, programCounter, instruction);
        this.token = token;
    }

    /**
     * @return The offending operand token.
     */
    public String getToken() {
        return token;
    }
}
