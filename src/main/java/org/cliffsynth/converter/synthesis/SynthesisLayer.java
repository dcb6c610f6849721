package org.cliffsynth.converter.synthesis;

import org.cliffsynth.circuit.OpType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The layers of the canonical form H-CX-S-CX-S-CX-H-S-CX-S-CX followed by the Pauli
 * correction, in emission order. The first Hadamard layer is realised with V gates.
 */
public enum SynthesisLayer {
    RANK_FIX(OpType.V),
    ELIMINATE_STABILIZER_X(OpType.CX),
    STABILIZER_DIAGONAL(OpType.S),
    STABILIZER_FACTOR(OpType.CX),
    STABILIZER_PHASE(OpType.S),
    ELIMINATE_STABILIZER_FACTOR(OpType.CX),
    HADAMARD(OpType.H),
    DESTABILIZER_DIAGONAL(OpType.S),
    DESTABILIZER_FACTOR(OpType.CX),
    DESTABILIZER_PHASE(OpType.S),
    ELIMINATE_DESTABILIZER_X(OpType.CX),
    PAULI_CORRECTION(OpType.Z, OpType.X);

    private final Set<OpType> gateTypes;

    SynthesisLayer(OpType first, OpType... rest) {
        this.gateTypes = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    /**
     * @return The gate types this layer may emit.
     */
    public Set<OpType> gateTypes() {
        return gateTypes;
    }
}
