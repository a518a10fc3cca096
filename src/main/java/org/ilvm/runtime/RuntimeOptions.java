package org.ilvm.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Run-time settings of a {@link VirtualMachine}, read from the {@code ilvm.runtime}
 * section of the HOCON configuration.
 *
 * <pre>
 * ilvm.runtime {
 *   unresolved-operand = FAIL   # or ZERO
 *   trace = false
 * }
 * </pre>
 *
 * @param unresolvedOperand The policy for operands that cannot be resolved.
 * @param trace Whether every executed step is written to the trace log.
 */
public record RuntimeOptions(UnresolvedOperandPolicy unresolvedOperand, boolean trace) {

    /**
     * The configuration path of the runtime section.
     */
    public static final String CONFIG_PATH = "ilvm.runtime";

    private static final String UNRESOLVED_OPERAND_KEY = "unresolved-operand";
    private static final String TRACE_KEY = "trace";

    /**
     * Creates options and rejects a missing policy.
     * @param unresolvedOperand The policy for operands that cannot be resolved.
     * @param trace Whether tracing is enabled.
     */
    public RuntimeOptions {
        if (unresolvedOperand == null) {
            throw new IllegalArgumentException("unresolvedOperand must not be null");
        }
    }

    /**
     * Returns the built-in defaults: fail on unresolved operands, no tracing.
     * @return The default options.
     */
    public static RuntimeOptions defaults() {
        return new RuntimeOptions(UnresolvedOperandPolicy.FAIL, false);
    }

    /**
     * Loads options from the classpath configuration.
     * Load order: system properties, {@code application.conf}, {@code reference.conf}.
     * @return The resolved options.
     * @throws ConfigException if the configuration is malformed.
     */
    public static RuntimeOptions load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads options from an explicit configuration. Missing keys fall back to the
     * shipped {@code reference.conf}.
     * @param config The root configuration.
     * @return The resolved options.
     * @throws ConfigException if a value has the wrong type or an unknown policy name.
     */
    public static RuntimeOptions fromConfig(Config config) {
        Config runtime = config.withFallback(ConfigFactory.defaultReference()).resolve().getConfig(CONFIG_PATH);
        UnresolvedOperandPolicy policy = runtime.getEnum(UnresolvedOperandPolicy.class, UNRESOLVED_OPERAND_KEY);
        return new RuntimeOptions(policy, runtime.getBoolean(TRACE_KEY));
    }

    /**
     * Returns a copy with a different unresolved-operand policy.
     * @param policy The new policy.
     * @return The modified options.
     */
    public RuntimeOptions withUnresolvedOperand(UnresolvedOperandPolicy policy) {
        return new RuntimeOptions(policy, trace);
    }

    /**
     * Returns a copy with tracing switched on or off.
     * @param enabled Whether tracing is enabled.
     * @return The modified options.
     */
    public RuntimeOptions withTrace(boolean enabled) {
        return new RuntimeOptions(unresolvedOperand, enabled);
    }
}
