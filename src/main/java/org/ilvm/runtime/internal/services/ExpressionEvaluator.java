package org.ilvm.runtime.internal.services;

import org.ilvm.runtime.Config;
import org.ilvm.runtime.UnresolvedOperandPolicy;
import org.ilvm.runtime.api.ExecutionException;
import org.ilvm.runtime.api.UndefinedRegisterException;
import org.ilvm.runtime.api.UnknownExpressionException;
import org.ilvm.runtime.isa.InstructionArgumentTypeUtils;
import org.ilvm.runtime.model.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.OptionalLong;

/**
 * Resolves an operand token to a 32-bit unsigned word.
 * <p>
 * Resolution order: decimal literal, {@code 16#} hexadecimal literal, register name.
 * Literals wider than 32 bits are reduced modulo 2^32. The evaluator never writes
 * a register.
 * <p>
 * Tokens that resolve to nothing are handled by the configured
 * {@link UnresolvedOperandPolicy}.
 */
public class ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final UnresolvedOperandPolicy policy;

    /**
     * Creates an evaluator.
     * @param policy The policy for tokens that cannot be resolved.
     */
    public ExpressionEvaluator(UnresolvedOperandPolicy policy) {
        this.policy = policy;
    }


    /**
     * Evaluates a token.
     * @param token The operand token.
     * @param context The context of the executing instruction, used for register
     *                lookup and error locations.
     * @return The masked value.
     * @throws UnknownExpressionException if the token is malformed and the policy is FAIL.
     * @throws UndefinedRegisterException if the token names an unwritten register and the policy is FAIL.
     */
    public long evaluate(String token, ExecutionContext context) throws ExecutionException {
        if (InstructionArgumentTypeUtils.isDecimalLiteral(token)) {
            return parseLiteral(token, 10);
        }
        if (token.startsWith(Config.HEX_PREFIX)) {
            if (InstructionArgumentTypeUtils.isHexLiteral(token)) {
                return parseLiteral(token.substring(Config.HEX_PREFIX.length()), 16);
            }
            return unresolved(token, new UnknownExpressionException(token,
                    context.getProgramCounter(), context.getInstruction().toString()));
        }

        OptionalLong register = context.getRegisters().read(token);
        if (register.isPresent()) {
            return Word.mask(register.getAsLong());
        }
        if (InstructionArgumentTypeUtils.isIdentifier(token)) {
            return unresolved(token, new UndefinedRegisterException(token,
                    context.getProgramCounter(), context.getInstruction().toString()));
        }
        return unresolved(token, new UnknownExpressionException(token,
                context.getProgramCounter(), context.getInstruction().toString()));
    }

    private long parseLiteral(String digits, int radix) {
        return new BigInteger(digits, radix).longValue() & Config.WORD_MASK;
    }

    private long unresolved(String token, ExecutionException failure) throws ExecutionException {
        if (policy == UnresolvedOperandPolicy.ZERO) {
            LOG.warn("Substituting 0 for unresolved operand '{}': {}", token, failure.getMessage());
            return 0L;
        }
        throw failure;
    }
}
