package org.ilvm.runtime.internal.services;

import org.ilvm.compiler.api.ProgramArtifact;
import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.api.UndefinedLabelException;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.model.RegisterFile;

/**
 * Encapsulates everything an instruction may touch while it executes.
 * This object is created by the VirtualMachine for every step and passed to the
 * executing instruction to avoid global access.
 * <p>
 * The program counter held here starts at the index of the executing instruction.
 * Jumps overwrite it with {@code target - 1}; the machine adds 1 after the step.
 */
public class ExecutionContext {

    private final RegisterFile registers;
    private final ProgramArtifact program;
    private final ExpressionEvaluator evaluator;
    private final Instruction instruction;
    private int programCounter;

    /**
     * Constructs a new ExecutionContext.
     * @param registers The register table of the machine.
     * @param program The loaded program, for label resolution.
     * @param evaluator The evaluator for expression operands.
     * @param programCounter The index of the executing instruction.
     * @param instruction The executing instruction.
     */
    public ExecutionContext(RegisterFile registers, ProgramArtifact program, ExpressionEvaluator evaluator,
                            int programCounter, Instruction instruction) {
        this.registers = registers;
        this.program = program;
        this.evaluator = evaluator;
        this.programCounter = programCounter;
        this.instruction = instruction;
    }

    /**
     * Returns the register table.
     * @return The registers.
     */
    public RegisterFile getRegisters() {
        return registers;
    }

    /**
     * Returns the executing instruction.
     * @return The instruction.
     */
    public Instruction getInstruction() {
        return instruction;
    }

    /**
     * Returns the current program counter.
     * @return The program counter.
     */
    public int getProgramCounter() {
        return programCounter;
    }

    /**
     * Overwrites the program counter. The machine increments it once more after the step.
     * @param programCounter The new program counter.
     */
    public void setProgramCounter(int programCounter) {
        this.programCounter = programCounter;
    }

    /**
     * Evaluates an expression operand to a 32-bit word.
     * @param token The operand token.
     * @return The masked value.
     * @throws ExecutionException if the token cannot be resolved under the active policy.
     */
    public long evaluate(String token) throws ExecutionException {
        return evaluator.evaluate(token, this);
    }

    /**
     * Transfers control so that execution resumes at the instruction that follows the label.
     * @param label The label name.
     * @throws UndefinedLabelException if the program does not define the label.
     */
    public void jumpTo(String label) throws UndefinedLabelException {
        Integer target = program.labels().get(label);
        if (target == null) {
            throw new UndefinedLabelException(label, programCounter, instruction.toString());
        }
        programCounter = target - 1;
    }
}
