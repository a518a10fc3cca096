package org.ilvm.compiler.api;

/**
 * Thrown when the text before a colon is not a valid label name,
 * e.g. an empty label or one that contains whitespace.
 */
public class InvalidLabelException extends CompilationException {

    private final String label;

    /**
     * @param label The text found before the colon.
     * @param sourceInfo Where it was found.
     */
    public InvalidLabelException(String label, SourceInfo sourceInfo) {
        super("Invalid label '" + label + "'", sourceInfo);
        this.label = label;
    }

    /**
     * @return The text found before the colon.
     */
    public String getLabel() {
        return label;
    }
}
