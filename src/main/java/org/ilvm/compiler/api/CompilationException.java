package org.ilvm.compiler.api;

/**
 * An exception that is thrown when a program cannot be loaded.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * The subclasses name the kind of error.
 */
public class CompilationException extends Exception {

    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
        this.sourceInfo = null;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and source information.
     * @param message The detail message.
     * @param sourceInfo The source information.
     */
    public CompilationException(String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
        this.sourceInfo = sourceInfo;
    }

    /**
     * Returns where the error was found.
     * @return The source position, or null if unknown.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
