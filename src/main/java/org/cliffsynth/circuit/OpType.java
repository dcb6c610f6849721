package org.cliffsynth.circuit;

import java.util.EnumSet;
import java.util.Set;

/**
 * Gate kinds a {@link Circuit} can hold.
 * <p>
 * Only the Clifford generating set ({@link #H}, {@link #V}, {@link #S}, {@link #CX},
 * {@link #X}, {@link #Z}) can be converted to a tableau. The remaining kinds exist so
 * that circuits outside that set can be represented and rejected.
 */
public enum OpType {
    // region Clifford generating set
    /** Hadamard. */
    H(1),
    /** Square root of X. */
    V(1),
    /** Square root of Z (phase gate). */
    S(1),
    /** Controlled X, control first. */
    CX(2),
    /** Pauli X. */
    X(1),
    /** Pauli Z. */
    Z(1),
    // endregion

    // region Other gates
    Y(1),
    Sdg(1),
    Vdg(1),
    CY(2),
    CZ(2),
    SWAP(2),
    T(1),
    Tdg(1),
    Rz(1),
    Measure(1);
    // endregion

    private static final Set<OpType> GENERATING_SET = EnumSet.of(H, V, S, CX, X, Z);

    private final int arity;

    OpType(int arity) {
        this.arity = arity;
    }

    /**
     * @return The number of qubits a command of this type acts on.
     */
    public int arity() {
        return arity;
    }

    /**
     * @return {@code true} if this type belongs to {H, V, S, CX, X, Z}.
     */
    public boolean isCliffordGenerator() {
        return GENERATING_SET.contains(this);
    }

    /**
     * @return An unmodifiable view of the Clifford generating set.
     */
    public static Set<OpType> generatingSet() {
        return Set.copyOf(GENERATING_SET);
    }
}
