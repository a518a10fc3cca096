package org.ilvm.runtime.model;

import org.ilvm.runtime.Config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The register table of the machine: a mapping from register name to a 32-bit word.
 * <p>
 * The accumulator {@link Config#ACCUMULATOR} exists from construction on and holds 0.
 * Every other register is created implicitly by its first write. A register that was
 * never written is reported as absent, which is distinct from a register holding 0.
 * Names are case-sensitive and kept in first-write order.
 */
public class RegisterFile {

    private final Map<String, Long> registers = new LinkedHashMap<>();
    private final Map<String, Long> readOnlyView = Collections.unmodifiableMap(registers);

    /**
     * Creates a register table that contains only the accumulator, set to 0.
     */
    public RegisterFile() {
        registers.put(Config.ACCUMULATOR, 0L);
    }

    /**
     * Returns the current accumulator value.
     * @return The accumulator word.
     */
    public long getAccumulator() {
        return registers.get(Config.ACCUMULATOR);
    }

    /**
     * Sets the accumulator, masking the value to 32 bits.
     * @param value The new value.
     */
    public void setAccumulator(long value) {
        registers.put(Config.ACCUMULATOR, Word.mask(value));
    }

    /**
     * Checks whether the accumulator is truthy.
     * @return {@code true} if the accumulator is non-zero.
     */
    public boolean isAccumulatorTruthy() {
        return Word.isTruthy(getAccumulator());
    }

    /**
     * Writes a register, creating it if it does not exist yet.
     * @param name The register name.
     * @param value The new value, masked to 32 bits.
     */
    public void write(String name, long value) {
        registers.put(name, Word.mask(value));
    }

    /**
     * Reads a register.
     * @param name The register name.
     * @return The value, or an empty optional if the register was never written.
     */
    public OptionalLong read(String name) {
        Long value = registers.get(name);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    /**
     * Reads a register as a boolean, the way {@code S} and {@code R} set it.
     * @param name The register name.
     * @return The truthiness of the register, or empty if it was never written.
     */
    public Optional<Boolean> readBoolean(String name) {
        Long value = registers.get(name);
        return value == null ? Optional.empty() : Optional.of(Word.isTruthy(value));
    }

    /**
     * Checks whether a register has been written.
     * @param name The register name.
     * @return {@code true} if the register exists.
     */
    public boolean isDefined(String name) {
        return registers.containsKey(name);
    }

    /**
     * Returns the number of registers, including the accumulator.
     * @return The register count.
     */
    public int size() {
        return registers.size();
    }

    /**
     * Returns a live, read-only view of the table.
     * @return An unmodifiable view that reflects later writes.
     */
    public Map<String, Long> asMap() {
        return readOnlyView;
    }

    /**
     * Returns an immutable copy of the table as it is right now.
     * @return A snapshot in first-write order.
     */
    public Map<String, Long> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(registers));
    }

    @Override
    public String toString() {
        return registers.toString();
    }
}
