package org.cliffsynth.circuit;

import java.util.Objects;

/**
 * Identifies a qubit by register name and index, e.g. {@code q[0]}.
 *
 * @param register The register name, never empty.
 * @param index The index within the register, non-negative.
 */
public record Qubit(String register, int index) implements Comparable<Qubit> {

    /** Register used for qubits created by index only. */
    public static final String DEFAULT_REGISTER = "q";

    public Qubit {
        Objects.requireNonNull(register, "register");
        if (register.isEmpty()) {
            throw new IllegalArgumentException("Qubit register name must not be empty");
        }
        if (index < 0) {
            throw new IllegalArgumentException("Qubit index must be non-negative: " + index);
        }
    }

    /**
     * Creates a qubit in the default register.
     * @param index The index.
     * @return The qubit {@code q[index]}.
     */
    public static Qubit of(int index) {
        return new Qubit(DEFAULT_REGISTER, index);
    }

    /**
     * Parses {@code register[index]}, e.g. {@code "anc[2]"}.
     * @param text The text.
     * @return The qubit.
     * @throws IllegalArgumentException if the text is not of that form.
     */
    public static Qubit parse(String text) {
        String trimmed = text.trim();
        int open = trimmed.indexOf('[');
        if (open <= 0 || !trimmed.endsWith("]")) {
            throw new IllegalArgumentException("Expected register[index] but got '" + text + "'");
        }
        try {
            return new Qubit(trimmed.substring(0, open), Integer.parseInt(trimmed.substring(open + 1, trimmed.length() - 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid qubit index in '" + text + "'", e);
        }
    }

    @Override
    public int compareTo(Qubit other) {
        int byRegister = register.compareTo(other.register);
        return byRegister != 0 ? byRegister : Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return register + "[" + index + "]";
    }
}
