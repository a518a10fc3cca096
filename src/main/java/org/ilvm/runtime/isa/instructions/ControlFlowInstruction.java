package org.ilvm.runtime.isa.instructions;

import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.internal.services.ExecutionContext;
import org.ilvm.runtime.isa.Instruction;

import java.util.List;

/**
 * Handles the jump instructions JMP, JMPC and JMPNC.
 * The label is resolved when the jump is taken, so forward references work.
 */
public class ControlFlowInstruction extends Instruction {

    /**
     * Constructs a new ControlFlowInstruction.
     * @param name The mnemonic.
     * @param operands The operand tokens.
     */
    public ControlFlowInstruction(String name, List<String> operands) {
        super(name, operands);
    }

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        boolean taken = switch (name) {
            case "JMP" -> true;
            case "JMPC" -> context.getRegisters().isAccumulatorTruthy();
            case "JMPNC" -> !context.getRegisters().isAccumulatorTruthy();
            default -> throw new IllegalStateException("Unknown control flow instruction: " + name);
        };
        if (taken) {
            context.jumpTo(operand());
        }
    }

    /**
     * Returns the label this jump targets.
     * @return The label name.
     */
    public String getTargetLabel() {
        return operand();
    }
}
