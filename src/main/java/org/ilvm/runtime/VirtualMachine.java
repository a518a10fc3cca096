package org.ilvm.runtime;

import org.ilvm.compiler.Compiler;
import org.ilvm.compiler.api.CompilationException;
import org.ilvm.compiler.api.ProgramArtifact;
import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.internal.services.ExecutionContext;
import org.ilvm.runtime.internal.services.ExpressionEvaluator;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.model.RegisterFile;
import org.ilvm.runtime.services.LoggingExecutionObserver;
import org.ilvm.runtime.spi.IExecutionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The core of the interpreter.
 * This class owns the register table, the program counter and the loaded program,
 * and runs the fetch-execute loop.
 * <p>
 * A machine is single-use: it loads exactly one program and runs it from
 * {@code pc = 0, registers = {ACC: 0}} until the program counter leaves the
 * instruction sequence. There is no halt instruction and no guard against
 * endless loops. It is not thread-safe.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final RegisterFile registers = new RegisterFile();
    private final ExpressionEvaluator evaluator;
    private IExecutionObserver observer;
    private ProgramArtifact program = ProgramArtifact.empty();
    private boolean loaded = false;
    private int programCounter = 0;
    private long executedSteps = 0;

    /**
     * Creates a machine with the built-in default options.
     */
    public VirtualMachine() {
        this(RuntimeOptions.defaults());
    }

    /**
     * Creates a machine. If tracing is enabled, a {@link LoggingExecutionObserver} is installed.
     * @param options The run-time options.
     */
    public VirtualMachine(RuntimeOptions options) {
        this(options, options.trace() ? new LoggingExecutionObserver() : IExecutionObserver.NONE);
    }

    /**
     * Creates a machine with an explicit trace observer.
     * @param options The run-time options.
     * @param observer The observer notified after every step.
     */
    public VirtualMachine(RuntimeOptions options, IExecutionObserver observer) {
        this.evaluator = new ExpressionEvaluator(options.unresolvedOperand());
        this.observer = observer != null ? observer : IExecutionObserver.NONE;
    }

    /**
     * Replaces the trace observer.
     * @param observer The new observer, or null to disable tracing.
     */
    public void setObserver(IExecutionObserver observer) {
        this.observer = observer != null ? observer : IExecutionObserver.NONE;
    }

    /**
     * Compiles and loads program text. Nothing is loaded if compilation fails.
     * @param source The full program text.
     * @throws CompilationException if the program contains an error.
     * @throws IllegalStateException if a program was already loaded.
     */
    public void loadProgram(String source) throws CompilationException {
        requireNotLoaded();
        loadProgram(new Compiler().compile(source, Config.IN_MEMORY_PROGRAM_NAME));
    }

    /**
     * Loads an already compiled program.
     * @param artifact The program.
     * @throws IllegalStateException if a program was already loaded.
     */
    public void loadProgram(ProgramArtifact artifact) {
        requireNotLoaded();
        this.program = artifact;
        this.loaded = true;
        LOG.debug("Loaded program '{}' with {} instructions and {} labels.",
                artifact.programName(), artifact.size(), artifact.labels().size());
    }

    /**
     * Runs the program until the program counter leaves the instruction sequence.
     * Running a machine without a program, or one that has already terminated, does nothing.
     * @throws ExecutionException if an instruction fails. The registers keep the state
     *         from before the failing instruction.
     */
    public void run() throws ExecutionException {
        LOG.debug("Running '{}' from pc={}.", program.programName(), programCounter);
        while (step()) {
            // step() does the work
        }
        LOG.debug("Program '{}' terminated after {} steps.", program.programName(), executedSteps);
    }

    /**
     * Executes exactly one instruction, then advances the program counter by one.
     * @return {@code true} if an instruction was executed, {@code false} if the machine had already terminated.
     * @throws ExecutionException if the instruction fails. The program counter stays on it.
     */
    public boolean step() throws ExecutionException {
        if (isTerminated()) {
            return false;
        }

        int pc = programCounter;
        Instruction instruction = program.instructions().get(pc);
        ExecutionContext context = new ExecutionContext(registers, program, evaluator, pc, instruction);
        instruction.execute(context);

        programCounter = context.getProgramCounter() + 1;
        executedSteps++;
        observer.afterStep(pc, instruction, registers.asMap());
        return true;
    }

    /**
     * Checks whether execution has fallen off the end of the program.
     * @return {@code true} if no further instruction can be fetched.
     */
    public boolean isTerminated() {
        return programCounter >= program.size();
    }

    /**
     * Returns the index of the next instruction to execute.
     * @return The program counter.
     */
    public int getProgramCounter() {
        return programCounter;
    }

    /**
     * Returns the number of instructions executed so far.
     * @return The step count.
     */
    public long getExecutedSteps() {
        return executedSteps;
    }

    /**
     * Returns the live register table.
     * @return The registers.
     */
    public RegisterFile getRegisters() {
        return registers;
    }

    /**
     * Returns an immutable copy of the register table.
     * @return The registers by name.
     */
    public Map<String, Long> getRegisterSnapshot() {
        return registers.snapshot();
    }

    /**
     * Returns the loaded program.
     * @return The program, or an empty program if none was loaded.
     */
    public ProgramArtifact getProgram() {
        return program;
    }

    private void requireNotLoaded() {
        if (loaded) {
            throw new IllegalStateException("A program is already loaded; create a new VirtualMachine to run another one.");
        }
    }
}
