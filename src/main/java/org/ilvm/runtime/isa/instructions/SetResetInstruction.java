package org.ilvm.runtime.isa.instructions;

import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.internal.services.ExecutionContext;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.model.RegisterFile;
import org.ilvm.runtime.model.Word;

import java.util.List;

/**
 * Handles the conditional set and reset instructions S and R.
 * While the accumulator is truthy, S writes 1 and R writes 0 to the variable;
 * otherwise both leave the register table untouched.
 */
public class SetResetInstruction extends Instruction {

    /**
     * Constructs a new SetResetInstruction.
     * @param name The mnemonic.
     * @param operands The operand tokens.
     */
    public SetResetInstruction(String name, List<String> operands) {
        super(name, operands);
    }

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        RegisterFile registers = context.getRegisters();
        if (!registers.isAccumulatorTruthy()) {
            return;
        }
        switch (name) {
            case "S" -> registers.write(operand(), Word.fromBoolean(true));
            case "R" -> registers.write(operand(), Word.fromBoolean(false));
            default -> throw new IllegalStateException("Unknown set/reset instruction: " + name);
        }
    }
}
