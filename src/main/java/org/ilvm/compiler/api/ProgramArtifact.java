package org.ilvm.compiler.api;

import org.ilvm.runtime.Config;
import org.ilvm.runtime.isa.Instruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The immutable result of a successful compilation.
 *
 * @param programName The name of the program.
 * @param instructions The instruction sequence in execution order.
 * @param labels Maps each label to the index of the instruction that follows it.
 *               A label at the very end maps to {@code instructions.size()}.
 * @param sourceMap The source position of each instruction, parallel to {@code instructions}.
 */
public record ProgramArtifact(
        String programName,
        List<Instruction> instructions,
        Map<String, Integer> labels,
        List<SourceInfo> sourceMap
) {

    /**
     * Creates the artifact and freezes all collections.
     */
    public ProgramArtifact {
        if (sourceMap.size() != instructions.size()) {
            throw new IllegalArgumentException("Source map must have one entry per instruction.");
        }
        instructions = List.copyOf(instructions);
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        sourceMap = List.copyOf(sourceMap);
    }

    /**
     * Returns a program without instructions.
     * @return The empty program.
     */
    public static ProgramArtifact empty() {
        return new ProgramArtifact(Config.IN_MEMORY_PROGRAM_NAME, List.of(), Map.of(), List.of());
    }

    /**
     * Returns the number of instructions.
     * @return The program length.
     */
    public int size() {
        return instructions.size();
    }
}
