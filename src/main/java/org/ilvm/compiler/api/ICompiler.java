package org.ilvm.compiler.api;

import java.util.List;

/**
 * The public interface for the IL program loader.
 * Turns program text into an executable {@link ProgramArtifact}.
 */
public interface ICompiler {

    /**
     * Compiles program text.
     *
     * @param source The full program, newline separated.
     * @param programName The name of the program, used in diagnostics.
     * @return The compiled program.
     * @throws CompilationException at the first error; no artifact is produced.
     */
    ProgramArtifact compile(String source, String programName) throws CompilationException;

    /**
     * Compiles program lines.
     *
     * @param sourceLines The program lines.
     * @param programName The name of the program, used in diagnostics.
     * @return The compiled program.
     * @throws CompilationException at the first error; no artifact is produced.
     */
    ProgramArtifact compile(List<String> sourceLines, String programName) throws CompilationException;
}
