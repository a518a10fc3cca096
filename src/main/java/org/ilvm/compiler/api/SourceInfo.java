package org.ilvm.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The program name or file where the code is located.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 * @param lineContent The content of the line, trimmed.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d ('%s')", fileName, lineNumber, columnNumber, lineContent);
    }
}
