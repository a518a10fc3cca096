package org.ilvm.runtime.isa.instructions;

import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.internal.services.ExecutionContext;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.model.RegisterFile;
import org.ilvm.runtime.model.Word;

import java.util.List;

/**
 * Handles the logic instructions on the accumulator: AND, OR, XOR, their
 * operand-inverting N variants, and NOT.
 */
public class BitwiseInstruction extends Instruction {

    /**
     * Constructs a new BitwiseInstruction.
     * @param name The mnemonic.
     * @param operands The operand tokens.
     */
    public BitwiseInstruction(String name, List<String> operands) {
        super(name, operands);
    }

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        RegisterFile registers = context.getRegisters();
        long acc = registers.getAccumulator();

        if ("NOT".equals(name)) {
            registers.setAccumulator(Word.complement(acc));
            return;
        }

        long value = context.evaluate(operand());
        long result = switch (name) {
            case "AND" -> acc & value;
            case "ANDN" -> acc & Word.complement(value);
            case "OR" -> acc | value;
            case "ORN" -> acc | Word.complement(value);
            case "XOR" -> acc ^ value;
            case "XORN" -> acc ^ Word.complement(value);
            default -> throw new IllegalStateException("Unknown bitwise instruction: " + name);
        };
        registers.setAccumulator(result);
    }
}
