package org.ilvm.runtime.spi;

import org.ilvm.runtime.isa.Instruction;

import java.util.Map;

/**
 * Receives a notification after every instruction the machine executes.
 * This is the trace channel of the interpreter; it has no influence on execution.
 * <p>
 * Implementations must not keep the register map beyond the call, since it is a
 * live read-only view that changes with the next step.
 */
@FunctionalInterface
public interface IExecutionObserver {

    /**
     * An observer that ignores every step.
     */
    IExecutionObserver NONE = (programCounter, instruction, registers) -> { };

    /**
     * Called after an instruction has executed successfully.
     *
     * @param programCounter the index of the instruction that was executed
     * @param instruction the executed instruction
     * @param registers a read-only view of the register table after the step
     */
    void afterStep(int programCounter, Instruction instruction, Map<String, Long> registers);
}
