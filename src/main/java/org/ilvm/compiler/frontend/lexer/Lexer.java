package org.ilvm.compiler.frontend.lexer;

import org.ilvm.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer is responsible for converting the program text into a sequence of tokens.
 * <p>
 * IL is line-oriented, so the only structure it recognizes is words separated by
 * whitespace, the label colon and line ends. Classifying a word as mnemonic, literal
 * or name is left to the parser.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the program being read, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", line, current - lineStart + 1, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ':' -> addToken(TokenType.COLON);
            case '\n' -> {
                addToken(TokenType.NEWLINE);
                line++;
                lineStart = current;
            }
            // Ignore whitespace
            case ' ', '\r', '\t', '\f' -> { }
            default -> {
                if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                    // Non-ASCII whitespace, e.g. U+2003 or U+3000
                    return;
                }
                if (Character.isISOControl(c)) {
                    diagnostics.reportError(String.format("Unexpected character: U+%04X", (int) c), logicalFileName, line);
                } else {
                    word();
                }
            }
        }
    }

    private void word() {
        while (isWordChar(peek())) advance();
        addToken(TokenType.WORD);
    }

    private boolean isWordChar(char c) {
        return c != '\0' && c != ':' && !Character.isWhitespace(c) && !Character.isSpaceChar(c) && !Character.isISOControl(c);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, line, start - lineStart + 1, logicalFileName));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }
}
