package org.cliffsynth.tableau;

/**
 * Single-qubit Pauli operators in symplectic (x, z) encoding.
 */
public enum Pauli {
    I(false, false),
    X(true, false),
    Y(true, true),
    Z(false, true);

    private final boolean x;
    private final boolean z;

    Pauli(boolean x, boolean z) {
        this.x = x;
        this.z = z;
    }

    public boolean x() {
        return x;
    }

    public boolean z() {
        return z;
    }

    /**
     * @param x The X bit.
     * @param z The Z bit.
     * @return The Pauli with that encoding.
     */
    public static Pauli fromBits(boolean x, boolean z) {
        if (x) {
            return z ? Y : X;
        }
        return z ? Z : I;
    }

    /**
     * @param symbol One of 'I', 'X', 'Y', 'Z' (case-insensitive).
     * @return The Pauli.
     */
    public static Pauli fromSymbol(char symbol) {
        return switch (Character.toUpperCase(symbol)) {
            case 'I' -> I;
            case 'X' -> X;
            case 'Y' -> Y;
            case 'Z' -> Z;
            default -> throw new IllegalArgumentException("Not a Pauli symbol: '" + symbol + "'");
        };
    }
}
