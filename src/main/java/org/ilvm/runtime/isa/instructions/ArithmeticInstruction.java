package org.ilvm.runtime.isa.instructions;

import org.ilvm.runtime.api.DivisionByZeroException;
import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.internal.services.ExecutionContext;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.model.RegisterFile;

import java.util.List;

/**
 * Handles the arithmetic instructions on the accumulator: ADD, SUB, MUL, DIV and MOD.
 * Results wrap modulo 2^32.
 */
public class ArithmeticInstruction extends Instruction {

    /**
     * Constructs a new ArithmeticInstruction.
     * @param name The mnemonic.
     * @param operands The operand tokens.
     */
    public ArithmeticInstruction(String name, List<String> operands) {
        super(name, operands);
    }

    @Override
    public void execute(ExecutionContext context) throws ExecutionException {
        RegisterFile registers = context.getRegisters();
        long acc = registers.getAccumulator();
        long value = context.evaluate(operand());

        // Both operands are below 2^32, so the low 32 bits of every long result are exact.
        long result = switch (name) {
            case "ADD" -> acc + value;
            case "SUB" -> acc - value;
            case "MUL" -> acc * value;
            case "DIV" -> {
                requireNonZero(value, context);
                yield acc / value;
            }
            case "MOD" -> {
                requireNonZero(value, context);
                yield acc % value;
            }
            default -> throw new IllegalStateException("Unknown arithmetic instruction: " + name);
        };
        registers.setAccumulator(result);
    }

    private void requireNonZero(long divisor, ExecutionContext context) throws DivisionByZeroException {
        if (divisor == 0L) {
            throw new DivisionByZeroException(context.getProgramCounter(), toString());
        }
    }
}
