package org.ilvm.runtime;

/**
 * Provides the fixed machine constants of the IL interpreter.
 * This final class contains static constants that define the register model
 * and literal syntax. It is not meant to be instantiated.
 * <p>
 * Behaviour that may vary between runs is configured through {@link RuntimeOptions}.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The name of the accumulator register. It always exists and starts at 0.
     */
    public static final String ACCUMULATOR = "ACC";

    /**
     * The mask applied to every register value to model a 32-bit machine word.
     */
    public static final long WORD_MASK = 0xFFFFFFFFL;

    /**
     * The prefix that marks a hexadecimal literal, e.g. {@code 16#FF}.
     */
    public static final String HEX_PREFIX = "16#";

    /**
     * The name used for programs loaded from a string rather than a file.
     */
    public static final String IN_MEMORY_PROGRAM_NAME = "<memory>";
}
