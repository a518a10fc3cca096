package org.ilvm.compiler;

import org.ilvm.compiler.api.CompilationException;
import org.ilvm.compiler.api.DuplicateLabelException;
import org.ilvm.compiler.api.ICompiler;
import org.ilvm.compiler.api.InvalidLabelException;
import org.ilvm.compiler.api.ProgramArtifact;
import org.ilvm.compiler.api.SourceInfo;
import org.ilvm.compiler.diagnostics.Diagnostic;
import org.ilvm.compiler.diagnostics.DiagnosticsEngine;
import org.ilvm.compiler.frontend.lexer.Lexer;
import org.ilvm.compiler.frontend.lexer.Token;
import org.ilvm.compiler.frontend.lexer.TokenType;
import org.ilvm.compiler.frontend.parser.InstructionParser;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.isa.InstructionArgumentTypeUtils;
import org.ilvm.runtime.isa.instructions.ControlFlowInstruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The program loader. It turns IL program text into a {@link ProgramArtifact}.
 * <p>
 * Blank lines are skipped. A line may start with {@code label:}; the label is bound
 * to the index the next instruction will get, so labels do not take a slot in the
 * instruction sequence. Any text after the colon is parsed as an instruction on the
 * same line. Jump targets are not resolved here but when the jump executes.
 * <p>
 * Loading stops at the first error. Jumps to labels that are never defined are
 * reported as warnings. This class is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final InstructionParser parser = new InstructionParser();
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    @Override
    public ProgramArtifact compile(List<String> sourceLines, String programName) throws CompilationException {
        return compile(String.join("\n", sourceLines), programName);
    }

    @Override
    public ProgramArtifact compile(String source, String programName) throws CompilationException {
        diagnostics = new DiagnosticsEngine();
        String[] lines = source.split("\n", -1);

        List<Token> tokens = new Lexer(source, diagnostics, programName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException("Lexical errors in " + programName + ":\n" + diagnostics.summary());
        }

        List<Instruction> instructions = new ArrayList<>();
        Map<String, Integer> labels = new LinkedHashMap<>();
        List<SourceInfo> sourceMap = new ArrayList<>();

        List<Token> lineTokens = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.NEWLINE || token.type() == TokenType.END_OF_FILE) {
                if (!lineTokens.isEmpty()) {
                    String content = lines[lineTokens.get(0).line() - 1].strip();
                    compileLine(lineTokens, content, programName, instructions, labels, sourceMap);
                    lineTokens.clear();
                }
            } else {
                lineTokens.add(token);
            }
        }

        reportUndefinedJumpTargets(programName, instructions, labels, sourceMap);
        for (Diagnostic warning : diagnostics.getWarnings()) {
            LOG.warn("{}", warning);
        }

        LOG.debug("Compiled '{}': {} instructions, {} labels.", programName, instructions.size(), labels.size());
        return new ProgramArtifact(programName, instructions, labels, sourceMap);
    }

    /**
     * Returns the diagnostics of the most recent compilation.
     * @return The diagnostics engine.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private void compileLine(List<Token> lineTokens, String content, String programName,
                             List<Instruction> instructions, Map<String, Integer> labels,
                             List<SourceInfo> sourceMap) throws CompilationException {
        List<Token> rest = lineTokens;

        int colon = indexOfColon(lineTokens, 0);
        if (colon >= 0) {
            List<Token> labelTokens = lineTokens.subList(0, colon);
            Token first = labelTokens.isEmpty() ? lineTokens.get(colon) : labelTokens.get(0);
            SourceInfo labelInfo = new SourceInfo(programName, first.line(), first.column(), content);
            String label = labelTokens.stream().map(Token::text).collect(Collectors.joining(" "));

            if (labelTokens.size() != 1 || !InstructionArgumentTypeUtils.isIdentifier(label)) {
                throw new InvalidLabelException(label, labelInfo);
            }
            if (labels.containsKey(label)) {
                throw new DuplicateLabelException(label, labelInfo);
            }
            labels.put(label, instructions.size());

            rest = lineTokens.subList(colon + 1, lineTokens.size());
            int secondColon = indexOfColon(rest, 0);
            if (secondColon >= 0) {
                Token extra = rest.get(secondColon);
                throw new CompilationException("Only one label per line is supported",
                        new SourceInfo(programName, extra.line(), extra.column(), content));
            }
        }

        if (rest.isEmpty()) {
            return;
        }

        Token mnemonic = rest.get(0);
        SourceInfo info = new SourceInfo(programName, mnemonic.line(), mnemonic.column(), content);
        instructions.add(parser.parse(rest, info));
        sourceMap.add(info);
    }

    private int indexOfColon(List<Token> tokens, int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (tokens.get(i).type() == TokenType.COLON) {
                return i;
            }
        }
        return -1;
    }

    private void reportUndefinedJumpTargets(String programName, List<Instruction> instructions,
                                            Map<String, Integer> labels, List<SourceInfo> sourceMap) {
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i) instanceof ControlFlowInstruction jump && !labels.containsKey(jump.getTargetLabel())) {
                diagnostics.reportWarning("Jump to undefined label '" + jump.getTargetLabel() + "'",
                        programName, sourceMap.get(i).lineNumber());
            }
        }
    }
}
