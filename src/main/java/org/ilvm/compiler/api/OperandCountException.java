package org.ilvm.compiler.api;

/**
 * Thrown when an instruction has more or fewer operands than its signature requires.
 */
public class OperandCountException extends CompilationException {

    private final String mnemonic;
    private final int expected;
    private final int actual;

    /**
     * @param mnemonic The instruction.
     * @param expected The number of operands it takes.
     * @param actual The number of operands found.
     * @param sourceInfo Where it was found.
     */
    public OperandCountException(String mnemonic, int expected, int actual, SourceInfo sourceInfo) {
        super(String.format("%s expects %d operand(s) but got %d", mnemonic, expected, actual), sourceInfo);
        this.mnemonic = mnemonic;
        this.expected = expected;
        this.actual = actual;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
