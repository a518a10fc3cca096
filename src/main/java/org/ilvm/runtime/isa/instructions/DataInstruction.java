package org.ilvm.runtime.isa.instructions;

import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.internal.services.ExecutionContext;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.model.RegisterFile;

import java.util.List;

/**
 * Handles data movement between the accumulator and the other registers: LD and ST.
 */
public class DataInstruction extends Instruction {

    /**
     * Constructs a new DataInstruction.
     * @param name The mnemonic.
     * @param operands The operand tokens.
     */
    public DataInstruction(String name, List<String> operands) {
        super(name, operands);
    }

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        RegisterFile registers = context.getRegisters();
        switch (name) {
            case "LD" -> registers.setAccumulator(context.evaluate(operand()));
            case "ST" -> registers.write(operand(), registers.getAccumulator());
            default -> throw new IllegalStateException("Unknown data instruction: " + name);
        }
    }
}
