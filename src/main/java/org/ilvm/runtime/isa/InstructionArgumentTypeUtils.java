package org.ilvm.runtime.isa;

import org.ilvm.runtime.Config;

import java.util.regex.Pattern;

/**
 * Utility class for the lexical shape of operand tokens.
 * Shared by the parser (syntax checks at load time) and the expression evaluator.
 */
public final class InstructionArgumentTypeUtils {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DECIMAL = Pattern.compile("[0-9]+");
    private static final Pattern HEX_DIGITS = Pattern.compile("[0-9A-Fa-f]+");

    private InstructionArgumentTypeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Checks whether a token is a register or label name.
     * @param token The token.
     * @return {@code true} for a letter or underscore followed by letters, digits or underscores.
     */
    public static boolean isIdentifier(String token) {
        return token != null && IDENTIFIER.matcher(token).matches();
    }

    /**
     * Checks whether a token consists of decimal digits only.
     * @param token The token.
     * @return {@code true} for a decimal literal.
     */
    public static boolean isDecimalLiteral(String token) {
        return token != null && DECIMAL.matcher(token).matches();
    }

    /**
     * Checks whether a token is a well-formed hexadecimal literal such as {@code 16#F0}.
     * @param token The token.
     * @return {@code true} if the token has the hex prefix followed by at least one hex digit.
     */
    public static boolean isHexLiteral(String token) {
        return token != null
                && token.startsWith(Config.HEX_PREFIX)
                && HEX_DIGITS.matcher(token.substring(Config.HEX_PREFIX.length())).matches();
    }

    /**
     * Checks whether a token is acceptable for an operand of the given type.
     * Expressions are only checked loosely here; malformed literals are reported
     * by the expression evaluator when they are executed.
     *
     * @param argType The expected operand type.
     * @param token The operand token.
     * @return {@code true} if the token fits the type.
     */
    public static boolean accepts(InstructionArgumentType argType, String token) {
        if (argType == null || token == null || token.isEmpty()) {
            return false;
        }

        return switch (argType) {
            case EXPRESSION -> true;
            case VARIABLE, LABEL -> isIdentifier(token);
        };
    }

    /**
     * Returns a human readable name of an operand type for error messages.
     * @param argType The operand type.
     * @return The display name, or "UNKNOWN" if null.
     */
    public static String toDisplayString(InstructionArgumentType argType) {
        if (argType == null) {
            return "UNKNOWN";
        }

        return switch (argType) {
            case EXPRESSION -> "expression";
            case VARIABLE -> "variable name";
            case LABEL -> "label";
        };
    }
}
