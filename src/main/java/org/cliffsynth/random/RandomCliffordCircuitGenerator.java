package org.cliffsynth.random;

import org.apache.commons.math3.random.Well19937c;
import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.circuit.OpType;

import java.util.List;

/**
 * Builds reproducible random circuits over the Clifford generating set.
 * <p>
 * Backed by Apache Commons Math {@link Well19937c}; the same seed, qubit count and depth
 * always yield the same circuit. Not thread-safe.
 */
public final class RandomCliffordCircuitGenerator {

    private static final List<OpType> SINGLE_QUBIT_GATES = List.of(OpType.H, OpType.V, OpType.S, OpType.X, OpType.Z);

    private final Well19937c rng;

    /**
     * Creates a new seeded generator.
     * @param seed The initial seed for the random number generator.
     */
    public RandomCliffordCircuitGenerator(long seed) {
        this.rng = new Well19937c(seed);
    }

    /**
     * Generates a circuit of {@code depth} gates on {@code qubits} qubits. CX is only drawn
     * when at least two qubits exist.
     *
     * @param qubits The qubit count, non-negative.
     * @param depth The number of gates, non-negative.
     * @return The generated circuit over {@code q[0] .. q[qubits-1]}.
     */
    public Circuit generate(int qubits, int depth) {
        if (qubits < 0 || depth < 0) {
            throw new IllegalArgumentException("qubits and depth must be non-negative, got " + qubits + " and " + depth);
        }
        Circuit circuit = new Circuit(qubits);
        if (qubits == 0) {
            return circuit;
        }
        int choices = qubits > 1 ? SINGLE_QUBIT_GATES.size() + 1 : SINGLE_QUBIT_GATES.size();
        for (int g = 0; g < depth; g++) {
            int pick = rng.nextInt(choices);
            if (pick == SINGLE_QUBIT_GATES.size()) {
                int control = rng.nextInt(qubits);
                int target = rng.nextInt(qubits - 1);
                if (target >= control) {
                    target++;
                }
                circuit.addOp(OpType.CX, control, target);
            } else {
                circuit.addOp(SINGLE_QUBIT_GATES.get(pick), rng.nextInt(qubits));
            }
        }
        return circuit;
    }
}
