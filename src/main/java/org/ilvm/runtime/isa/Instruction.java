package org.ilvm.runtime.isa;

import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.internal.services.ExecutionContext;
import org.ilvm.runtime.isa.instructions.ArithmeticInstruction;
import org.ilvm.runtime.isa.instructions.BitwiseInstruction;
import org.ilvm.runtime.isa.instructions.ControlFlowInstruction;
import org.ilvm.runtime.isa.instructions.DataInstruction;
import org.ilvm.runtime.isa.instructions.SetResetInstruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The abstract base class for all IL instructions.
 * <p>
 * An instruction is created once at load time with its mnemonic and operand tokens and
 * is never mutated afterwards. Execution happens against an {@link ExecutionContext}
 * that exposes the register table, the label table and the program counter.
 * <p>
 * The instruction set is closed: every mnemonic is registered in {@link #init()}
 * together with the family class that executes it and its operand signature.
 */
public abstract class Instruction {

    protected final String name;
    protected final List<String> operands;

    /**
     * Creates a family instance for a registered mnemonic.
     */
    @FunctionalInterface
    public interface Factory {
        /**
         * @param name The mnemonic.
         * @param operands The operand tokens, already checked against the signature.
         * @return The new instruction.
         */
        Instruction create(String name, List<String> operands);
    }

    // Registries, keyed by mnemonic
    private static final Map<String, Factory> FACTORIES_BY_NAME = new LinkedHashMap<>();
    private static final Map<String, InstructionSignature> SIGNATURES_BY_NAME = new LinkedHashMap<>();

    static {
        init();
    }

    /**
     * Constructs a new instruction.
     * @param name The mnemonic.
     * @param operands The operand tokens.
     */
    protected Instruction(String name, List<String> operands) {
        this.name = name;
        this.operands = List.copyOf(operands);
    }

    /**
     * Executes the instruction.
     * Implementations must not modify any register before all checks that can fail have passed.
     * @param context The execution context.
     * @throws ExecutionException if the instruction cannot be executed.
     */
    public abstract void execute(ExecutionContext context) throws ExecutionException;

    /**
     * Returns the mnemonic.
     * @return The mnemonic, e.g. {@code ANDN}.
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the operand tokens.
     * @return An unmodifiable list with zero or one element.
     */
    public List<String> getOperands() {
        return operands;
    }

    /**
     * Returns the single operand of a one-operand instruction.
     * @return The operand token.
     */
    protected String operand() {
        return operands.get(0);
    }

    /**
     * Returns the disassembled form of the instruction.
     * @return The mnemonic followed by its operand, e.g. {@code LD 16#F0}.
     */
    @Override
    public String toString() {
        return operands.isEmpty() ? name : name + " " + String.join(" ", operands);
    }

    /**
     * Registers all instruction families. Called once from the static initializer.
     */
    private static void init() {
        // Data-Family
        registerFamily(DataInstruction::new, List.of("LD"), InstructionSignature.of(InstructionArgumentType.EXPRESSION));
        registerFamily(DataInstruction::new, List.of("ST"), InstructionSignature.of(InstructionArgumentType.VARIABLE));

        // Bitwise-Family
        registerFamily(BitwiseInstruction::new, List.of("AND", "ANDN", "OR", "ORN", "XOR", "XORN"),
                InstructionSignature.of(InstructionArgumentType.EXPRESSION));
        registerFamily(BitwiseInstruction::new, List.of("NOT"), InstructionSignature.noArgs());

        // Arithmetic-Family
        registerFamily(ArithmeticInstruction::new, List.of("ADD", "SUB", "MUL", "DIV", "MOD"),
                InstructionSignature.of(InstructionArgumentType.EXPRESSION));

        // SetReset-Family
        registerFamily(SetResetInstruction::new, List.of("S", "R"), InstructionSignature.of(InstructionArgumentType.VARIABLE));

        // ControlFlow-Family
        registerFamily(ControlFlowInstruction::new, List.of("JMP", "JMPC", "JMPNC"), InstructionSignature.of(InstructionArgumentType.LABEL));
    }

    private static void registerFamily(Factory factory, List<String> names, InstructionSignature signature) {
        for (String mnemonic : names) {
            if (FACTORIES_BY_NAME.containsKey(mnemonic)) {
                throw new IllegalStateException("Instruction registered twice: " + mnemonic);
            }
            FACTORIES_BY_NAME.put(mnemonic, factory);
            SIGNATURES_BY_NAME.put(mnemonic, signature);
        }
    }

    /**
     * Checks whether a mnemonic belongs to the instruction set.
     * @param name The mnemonic, case-sensitive.
     * @return {@code true} if it is registered.
     */
    public static boolean isKnown(String name) {
        return FACTORIES_BY_NAME.containsKey(name);
    }

    /**
     * Returns the signature of a mnemonic.
     * @param name The mnemonic.
     * @return The signature, or empty if the mnemonic is unknown.
     */
    public static Optional<InstructionSignature> getSignature(String name) {
        return Optional.ofNullable(SIGNATURES_BY_NAME.get(name));
    }

    /**
     * Returns all registered mnemonics in registration order.
     * @return An unmodifiable set of mnemonics.
     */
    public static Set<String> getMnemonics() {
        return Collections.unmodifiableSet(FACTORIES_BY_NAME.keySet());
    }

    /**
     * Creates an instruction. The caller is responsible for having checked the
     * operands against {@link #getSignature(String)}.
     *
     * @param name The mnemonic.
     * @param operands The operand tokens.
     * @return The new instruction.
     * @throws IllegalArgumentException if the mnemonic is unknown or the operand count is wrong.
     */
    public static Instruction create(String name, List<String> operands) {
        Factory factory = FACTORIES_BY_NAME.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown instruction: " + name);
        }
        int arity = SIGNATURES_BY_NAME.get(name).getArity();
        if (operands.size() != arity) {
            throw new IllegalArgumentException(name + " expects " + arity + " operand(s), got " + operands.size());
        }
        return factory.create(name, operands);
    }
}
