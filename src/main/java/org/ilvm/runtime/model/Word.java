package org.ilvm.runtime.model;

import org.ilvm.runtime.Config;

/**
 * Helpers for 32-bit unsigned machine words.
 * <p>
 * A word is held in a {@code long} whose upper 32 bits are always zero, so the
 * full unsigned range 0..2^32-1 is representable without sign tricks.
 */
public final class Word {

    private Word() {}

    /**
     * Reduces an arbitrary value to the 32-bit word range.
     * @param value The raw value, possibly negative or wider than 32 bits.
     * @return The value modulo 2^32.
     */
    public static long mask(long value) {
        return value & Config.WORD_MASK;
    }

    /**
     * Returns the bitwise complement of a word.
     * @param value The word to invert.
     * @return The inverted word.
     */
    public static long complement(long value) {
        return mask(~value);
    }

    /**
     * Checks whether a word counts as true in a conditional instruction.
     * @param value The word to test.
     * @return {@code true} for any non-zero word.
     */
    public static boolean isTruthy(long value) {
        return mask(value) != 0L;
    }

    /**
     * Converts a boolean into the word that represents it.
     * @param value The boolean.
     * @return 1 for {@code true}, 0 for {@code false}.
     */
    public static long fromBoolean(boolean value) {
        return value ? 1L : 0L;
    }

    /**
     * Formats a word as an IL hexadecimal literal.
     * @param value The word.
     * @return The literal, e.g. {@code 16#FFFFFFF0}.
     */
    public static String toHexLiteral(long value) {
        return Config.HEX_PREFIX + Long.toHexString(mask(value)).toUpperCase();
    }
}
