package org.ilvm.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs while a program is loaded.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the program where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents loading. */
        ERROR,
        /** A warning that does not prevent loading. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
