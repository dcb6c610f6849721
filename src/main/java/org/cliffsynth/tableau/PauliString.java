package org.cliffsynth.tableau;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A signed tensor product of single-qubit Paulis, indexed by tableau qubit index.
 * Written as e.g. {@code -XIZ}; a missing sign means {@code +}.
 *
 * @param negative Whether the sign is -1.
 * @param paulis One Pauli per qubit index.
 */
public record PauliString(boolean negative, List<Pauli> paulis) {

    public PauliString {
        paulis = List.copyOf(paulis);
    }

    /**
     * Parses a signed Pauli string such as {@code "+XZ"}, {@code "-YI"} or {@code "ZZ"}.
     *
     * @param text The text.
     * @return The parsed string.
     * @throws IllegalArgumentException on characters other than a leading sign and I/X/Y/Z.
     */
    public static PauliString parse(String text) {
        Objects.requireNonNull(text, "text");
        String body = text.trim();
        boolean negative = false;
        if (body.startsWith("+") || body.startsWith("-")) {
            negative = body.charAt(0) == '-';
            body = body.substring(1);
        }
        List<Pauli> paulis = new ArrayList<>(body.length());
        for (char c : body.toCharArray()) {
            paulis.add(Pauli.fromSymbol(c));
        }
        return new PauliString(negative, paulis);
    }

    public int size() {
        return paulis.size();
    }

    public Pauli get(int index) {
        return paulis.get(index);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(paulis.size() + 1);
        sb.append(negative ? '-' : '+');
        for (Pauli p : paulis) {
            sb.append(p.name());
        }
        return sb.toString();
    }
}
