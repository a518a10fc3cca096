package org.ilvm.compiler.e2e;

import org.ilvm.runtime.VirtualMachine;
import org.ilvm.runtime.api.DivisionByZeroException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests that load program text into a fresh {@link VirtualMachine},
 * run it and inspect the register table.
 */
@Tag("integration")
public class InterpreterEndToEndTest {

    private static VirtualMachine run(String program) throws Exception {
        VirtualMachine vm = new VirtualMachine();
        vm.loadProgram(program);
        vm.run();
        return vm;
    }

    @Test
    void loadAndStore() throws Exception {
        VirtualMachine vm = run("LD 5\nST A");

        assertThat(vm.getRegisterSnapshot()).containsExactly(Map.entry("ACC", 5L), Map.entry("A", 5L));
    }

    @Test
    void maskingWithAnd() throws Exception {
        assertThat(run("LD 16#F0\nAND 16#0F\nST A").getRegisters().read("A")).hasValue(0L);
    }

    @Test
    void unconditionalJumpSkipsInstructions() throws Exception {
        VirtualMachine vm = run("JMP Skip\nLD 0\nST A\nSkip: LD 1\nST B");

        assertThat(vm.getRegisters().read("A")).isEmpty();
        assertThat(vm.getRegisters().read("B")).hasValue(1L);
    }

    @Test
    void unicodeWhitespaceSeparatesOperands() throws Exception {
        assertThat(run("LD\u20035\nST A").getRegisters().read("A")).hasValue(5L);
        assertThat(run("LD 5\u3000\nST A").getRegisters().read("A")).hasValue(5L);
    }

    @Test
    void division() throws Exception {
        assertThat(run("LD 20\nDIV 4\nST A").getRegisters().read("A")).hasValue(5L);
    }

    @Test
    void divisionByZeroStopsBeforeStore() throws Exception {
        VirtualMachine vm = new VirtualMachine();
        vm.loadProgram("LD 20\nDIV 0\nST A");

        assertThatThrownBy(vm::run).isInstanceOf(DivisionByZeroException.class);
        assertThat(vm.getRegisters().isDefined("A")).isFalse();
        assertThat(vm.getRegisters().getAccumulator()).isEqualTo(20L);
    }

    @Test
    void wrapsAroundAtThirtyTwoBits() throws Exception {
        assertThat(run("LD 16#FFFFFFFF\nADD 1\nST A").getRegisters().read("A")).hasValue(0L);
    }

    @Test
    void setAndReset() throws Exception {
        VirtualMachine vm = run("""
                LD 1
                S X
                R Y
                """);

        assertThat(vm.getRegisters().readBoolean("X")).hasValue(true);
        assertThat(vm.getRegisters().readBoolean("Y")).hasValue(false);
    }

    @Test
    void setIsNoOpWhenAccumulatorIsFalse() throws Exception {
        assertThat(run("LD 0\nS X").getRegisters().isDefined("X")).isFalse();
    }

    @Test
    void logicalOperations() throws Exception {
        VirtualMachine vm = run("""
                LD 16#F0
                AND 16#0F
                ST A
                LD 16#F0
                ANDN 16#0F
                ST B
                LD 16#F0
                OR 16#0F
                ST C
                LD 16#F0
                ORN 16#0F
                ST D
                LD 16#F0
                XOR 16#FF
                ST E
                LD 16#F0
                XORN 16#FF
                ST F
                LD 1
                NOT
                ST G
                """);

        assertThat(vm.getRegisterSnapshot()).containsAllEntriesOf(Map.of(
                "A", 0L,
                "B", 240L,
                "C", 255L,
                "D", 4294967280L,
                "E", 15L,
                "F", 4294967280L,
                "G", 4294967294L));
    }

    @Test
    void arithmeticOperations() throws Exception {
        VirtualMachine vm = run("""
                LD 10
                ADD 5
                ST A
                LD 10
                SUB 3
                ST B
                LD 2
                MUL 4
                ST C
                LD 20
                DIV 4
                ST D
                LD 20
                MOD 3
                ST E
                """);

        assertThat(vm.getRegisterSnapshot()).containsAllEntriesOf(Map.of(
                "A", 15L, "B", 7L, "C", 8L, "D", 5L, "E", 2L));
    }

    @Test
    void conditionalControlFlow() throws Exception {
        VirtualMachine vm = run("""
                LD 1
                JMP Skip
                LD 0
                ST A
                Skip: LD 1
                ST B
                LD 1
                JMPC Done
                LD 0
                ST C
                Done: LD 1
                ST D
                LD 0
                JMPNC End
                LD 0
                ST E
                End: LD 1
                ST F
                """);

        assertThat(vm.getRegisterSnapshot())
                .doesNotContainKeys("A", "C", "E")
                .containsAllEntriesOf(Map.of("B", 1L, "D", 1L, "F", 1L));
    }

    @Test
    void registersCanFeedLaterInstructions() throws Exception {
        VirtualMachine vm = run("""
                LD 6
                ST Six
                LD 7
                MUL Six
                ST Answer
                LD Answer
                MOD 16#10
                ST Low
                """);

        assertThat(vm.getRegisters().read("Answer")).hasValue(42L);
        assertThat(vm.getRegisters().read("Low")).hasValue(10L);
    }
}
