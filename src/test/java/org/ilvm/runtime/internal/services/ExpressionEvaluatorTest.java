package org.ilvm.runtime.internal.services;

import org.ilvm.compiler.api.ProgramArtifact;
import org.ilvm.junit.extensions.logging.ExpectLog;
import org.ilvm.junit.extensions.logging.LogWatchExtension;
import org.ilvm.runtime.UnresolvedOperandPolicy;
import org.ilvm.runtime.api.UndefinedRegisterException;
import org.ilvm.runtime.api.UnknownExpressionException;
import org.ilvm.runtime.isa.Instruction;
import org.ilvm.runtime.model.RegisterFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ilvm.junit.extensions.logging.LogLevel.WARN;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class ExpressionEvaluatorTest {

    private RegisterFile registers;

    @BeforeEach
    void setUp() {
        registers = new RegisterFile();
    }

    private long evaluate(UnresolvedOperandPolicy policy, String token) throws Exception {
        ExpressionEvaluator evaluator = new ExpressionEvaluator(policy);
        Instruction instruction = Instruction.create("LD", List.of(token));
        ExecutionContext context = new ExecutionContext(registers, ProgramArtifact.empty(), evaluator, 3, instruction);
        return evaluator.evaluate(token, context);
    }

    @Test
    void decimalLiteral() throws Exception {
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "42")).isEqualTo(42L);
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "007")).isEqualTo(7L);
    }

    @Test
    void hexLiteralInEitherCase() throws Exception {
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "16#F0")).isEqualTo(0xF0L);
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "16#ff")).isEqualTo(0xFFL);
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "16#FFFFFFFF")).isEqualTo(0xFFFFFFFFL);
    }

    @Test
    void literalsWiderThan32BitsWrap() throws Exception {
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "4294967296")).isZero();
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "16#123456789")).isEqualTo(0x23456789L);
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "99999999999999999999999")).isEqualTo(
                new BigInteger("99999999999999999999999").mod(BigInteger.ONE.shiftLeft(32)).longValue());
    }

    @Test
    void registerReference() throws Exception {
        registers.write("Counter", 17);

        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "Counter")).isEqualTo(17L);
        assertThat(evaluate(UnresolvedOperandPolicy.FAIL, "ACC")).isZero();
    }

    @Test
    void evaluationHasNoSideEffects() throws Exception {
        registers.write("A", 1);

        evaluate(UnresolvedOperandPolicy.FAIL, "A");
        evaluate(UnresolvedOperandPolicy.FAIL, "16#10");

        assertThat(registers.snapshot()).containsOnlyKeys("ACC", "A");
        assertThat(registers.getAccumulator()).isZero();
    }

    @Test
    void unwrittenRegisterFailsWithUndefinedRegister() {
        assertThatThrownBy(() -> evaluate(UnresolvedOperandPolicy.FAIL, "Missing"))
                .isInstanceOfSatisfying(UndefinedRegisterException.class, e -> {
                    assertThat(e.getRegisterName()).isEqualTo("Missing");
                    assertThat(e.getProgramCounter()).isEqualTo(3);
                    assertThat(e.getInstruction()).isEqualTo("LD Missing");
                });
    }

    @ParameterizedTest
    @ValueSource(strings = {"16#", "16#XZ", "12ab", "-1", "A-B", "8#17"})
    void malformedTokenFailsWithUnknownExpression(String token) {
        assertThatThrownBy(() -> evaluate(UnresolvedOperandPolicy.FAIL, token))
                .isInstanceOfSatisfying(UnknownExpressionException.class,
                        e -> assertThat(e.getToken()).isEqualTo(token));
    }

    @Test
    @ExpectLog(level = WARN,
               loggerPattern = "org\\.ilvm\\.runtime\\.internal\\.services\\.ExpressionEvaluator",
               messagePattern = "Substituting 0 for unresolved operand 'Missing'.*")
    void zeroPolicySubstitutesAndWarnsForUnwrittenRegister() throws Exception {
        assertThat(evaluate(UnresolvedOperandPolicy.ZERO, "Missing")).isZero();
    }

    @Test
    @ExpectLog(level = WARN, messagePattern = "Substituting 0 for unresolved operand '16#XZ'.*")
    void zeroPolicySubstitutesAndWarnsForMalformedToken() throws Exception {
        assertThat(evaluate(UnresolvedOperandPolicy.ZERO, "16#XZ")).isZero();
    }
}
