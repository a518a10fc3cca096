package org.ilvm.runtime.instructions;

import org.ilvm.runtime.VirtualMachine;
import org.ilvm.runtime.model.Word;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

public class VMBitwiseInstructionTest {

    private long accAfter(String program) throws Exception {
        VirtualMachine vm = new VirtualMachine();
        vm.loadProgram(program);
        vm.run();
        return vm.getRegisters().getAccumulator();
    }

    // --- AND ---
    @Test
    @Tag("unit")
    void testAnd() throws Exception {
        assertThat(accAfter("LD 16#F0\nAND 16#0F")).isZero();
        assertThat(accAfter("LD 16#FF\nAND 16#3C")).isEqualTo(0x3CL);
    }

    @Test
    @Tag("unit")
    void testAndn() throws Exception {
        assertThat(accAfter("LD 16#F0\nANDN 16#0F")).isEqualTo(240L);
        assertThat(accAfter("LD 16#FF\nANDN 16#0F")).isEqualTo(0xF0L);
    }

    // --- OR ---
    @Test
    @Tag("unit")
    void testOr() throws Exception {
        assertThat(accAfter("LD 16#F0\nOR 16#0F")).isEqualTo(255L);
    }

    @Test
    @Tag("unit")
    void testOrn() throws Exception {
        assertThat(accAfter("LD 16#F0\nORN 16#0F")).isEqualTo(4294967280L);
    }

    // --- XOR ---
    @Test
    @Tag("unit")
    void testXor() throws Exception {
        assertThat(accAfter("LD 16#F0\nXOR 16#FF")).isEqualTo(15L);
    }

    @Test
    @Tag("unit")
    void testXorn() throws Exception {
        assertThat(accAfter("LD 16#F0\nXORN 16#FF")).isEqualTo(4294967280L);
    }

    @Test
    @Tag("unit")
    void testOperandFromRegister() throws Exception {
        assertThat(accAfter("LD 16#0C\nST MASK\nLD 16#0A\nAND MASK")).isEqualTo(0x08L);
    }

    // --- NOT ---
    @Test
    @Tag("unit")
    void testNot() throws Exception {
        assertThat(accAfter("LD 1\nNOT")).isEqualTo(4294967294L);
        assertThat(accAfter("LD 0\nNOT")).isEqualTo(0xFFFFFFFFL);
    }

    @ParameterizedTest
    @Tag("unit")
    @ValueSource(longs = {0L, 1L, 0xF0L, 0x80000000L, 0xFFFFFFFFL, 123456789L})
    void testDoubleNotIsIdentity(long value) throws Exception {
        VirtualMachine vm = new VirtualMachine();
        vm.loadProgram("LD " + Word.toHexLiteral(value) + "\nNOT\nNOT\nST A");
        vm.run();
        assertThat(vm.getRegisters().read("A")).hasValue(value & 0xFFFFFFFFL);
    }
}
