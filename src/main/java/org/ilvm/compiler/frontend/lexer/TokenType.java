package org.ilvm.compiler.frontend.lexer;

/**
 * Defines the types of tokens the lexer can recognize.
 */
public enum TokenType {
    /** A run of characters without whitespace or colon: mnemonics, literals, names. */
    WORD,
    /** The colon that ends a label. */
    COLON,
    /** The end of a source line. */
    NEWLINE,
    /** The end of the source. */
    END_OF_FILE
}
