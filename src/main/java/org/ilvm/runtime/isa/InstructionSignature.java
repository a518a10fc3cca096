package org.ilvm.runtime.isa;

import java.util.Collections;
import java.util.List;

/**
 * Describes the expected signature of an instruction, i.e., the number
 * and types of its operands.
 *
 * @param argumentTypes An unmodifiable list of the expected operand types.
 */
public record InstructionSignature(List<InstructionArgumentType> argumentTypes) {

    /**
     * Creates a signature and ensures that the list is unmodifiable.
     * @param argumentTypes The list of operand types.
     */
    public InstructionSignature(List<InstructionArgumentType> argumentTypes) {
        this.argumentTypes = Collections.unmodifiableList(argumentTypes);
    }

    /**
     * Returns the expected number of operands.
     * @return The number of operands.
     */
    public int getArity() {
        return argumentTypes.size();
    }

    /**
     * Static helper method for instructions with no operands.
     * @return An empty signature.
     */
    public static InstructionSignature noArgs() {
        return new InstructionSignature(List.of());
    }

    /**
     * Static helper method for instructions with one operand.
     * @param type1 The type of the operand.
     * @return A signature with one operand.
     */
    public static InstructionSignature of(InstructionArgumentType type1) {
        return new InstructionSignature(List.of(type1));
    }
}
