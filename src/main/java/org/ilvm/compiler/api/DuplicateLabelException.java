package org.ilvm.compiler.api;

/**
 * Thrown when a label is defined more than once in a program.
 */
public class DuplicateLabelException extends CompilationException {

    private final String label;

    /**
     * @param label The label defined twice.
     * @param sourceInfo Where the second definition was found.
     */
    public DuplicateLabelException(String label, SourceInfo sourceInfo) {
        super("Duplicate label " + label, sourceInfo);
        this.label = label;
    }

    /**
     * @return The label defined twice.
     */
    public String getLabel() {
        return label;
    }
}
