package org.ilvm.compiler.frontend.parser;

import org.ilvm.compiler.api.CompilationException;
import org.ilvm.compiler.api.InvalidOperandException;
import org.ilvm.compiler.api.OperandCountException;
import org.ilvm.compiler.api.SourceInfo;
import org.ilvm.compiler.api.UnknownInstructionException;
import org.ilvm.compiler.diagnostics.DiagnosticsEngine;
import org.ilvm.compiler.frontend.lexer.Lexer;
import org.ilvm.compiler.frontend.lexer.Token;
import org.ilvm.compiler.frontend.lexer.TokenType;
import org.ilvm.runtime.Config;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.isa.InstructionArgumentType;
import org.ilvm.runtime.isa.InstructionArgumentTypeUtils;
import org.ilvm.runtime.isa.InstructionSignature;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the tokens of one source line (without its label) into an {@link Instruction}.
 * <p>
 * The first token is the mnemonic, which is looked up in the closed instruction set.
 * The remaining tokens are the operands; their count and shape must match the
 * instruction's {@link InstructionSignature}.
 */
public class InstructionParser {

    /**
     * Parses the tokens of one line.
     * @param lineTokens The WORD tokens of the line, mnemonic first. Must not be empty.
     * @param sourceInfo The position of the line, for error reporting.
     * @return The parsed instruction.
     * @throws UnknownInstructionException if the mnemonic is not recognized.
     * @throws OperandCountException if the number of operands is wrong.
     * @throws InvalidOperandException if a variable or label operand is not an identifier.
     */
    public Instruction parse(List<Token> lineTokens, SourceInfo sourceInfo) throws CompilationException {
        if (lineTokens.isEmpty()) {
            throw new IllegalArgumentException("Cannot parse an empty line.");
        }

        String mnemonic = lineTokens.get(0).text();
        InstructionSignature signature = Instruction.getSignature(mnemonic)
                .orElseThrow(() -> new UnknownInstructionException(mnemonic, sourceInfo));

        List<String> operands = new ArrayList<>();
        for (Token token : lineTokens.subList(1, lineTokens.size())) {
            operands.add(token.text());
        }
        if (operands.size() != signature.getArity()) {
            throw new OperandCountException(mnemonic, signature.getArity(), operands.size(), sourceInfo);
        }

        for (int i = 0; i < operands.size(); i++) {
            InstructionArgumentType argType = signature.argumentTypes().get(i);
            String operand = operands.get(i);
            if (!InstructionArgumentTypeUtils.accepts(argType, operand)) {
                throw new InvalidOperandException(mnemonic, operand,
                        InstructionArgumentTypeUtils.toDisplayString(argType), sourceInfo);
            }
        }

        return Instruction.create(mnemonic, operands);
    }

    /**
     * Parses a single instruction line such as {@code "ANDN 16#0F"}.
     * The line must not carry a label.
     * @param line The instruction text.
     * @return The parsed instruction.
     * @throws CompilationException if the line is empty, contains a colon or is not a valid instruction.
     */
    public Instruction parse(String line) throws CompilationException {
        String trimmed = line.strip();
        SourceInfo sourceInfo = new SourceInfo(Config.IN_MEMORY_PROGRAM_NAME, 1, 1, trimmed);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(trimmed, diagnostics).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), sourceInfo);
        }

        List<Token> words = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.WORD) {
                words.add(token);
            } else if (token.type() != TokenType.END_OF_FILE) {
                throw new CompilationException("Unexpected '" + token.text() + "' in instruction", sourceInfo);
            }
        }
        if (words.isEmpty()) {
            throw new CompilationException("Empty instruction", sourceInfo);
        }
        return parse(words, sourceInfo);
    }
}
