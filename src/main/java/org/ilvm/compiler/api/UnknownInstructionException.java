package org.ilvm.compiler.api;

/**
 * Thrown when a line starts with a mnemonic that is not part of the instruction set.
 */
public class UnknownInstructionException extends CompilationException {

    private final String mnemonic;

    /**
     * @param mnemonic The unrecognised mnemonic.
     * @param sourceInfo Where it was found.
     */
    public UnknownInstructionException(String mnemonic, SourceInfo sourceInfo) {
        super("Unknown instruction " + mnemonic, sourceInfo);
        this.mnemonic = mnemonic;
    }

    /**
     * @return The unrecognised mnemonic.
     */
    public String getMnemonic() {
        return mnemonic;
    }
}
