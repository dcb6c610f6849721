package org.cliffsynth.api;

import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.tableau.Tableau;

/**
 * Defines the public interface for converting between Clifford circuits and tableaux.
 * <p>
 * Implementations never mutate their arguments and always return fresh objects, so a
 * single instance may be shared between threads.
 */
public interface TableauConverter {

    /**
     * Simulates the circuit on the identity tableau.
     *
     * @param circuit A circuit built from {H, V, S, CX, X, Z}.
     * @return A new tableau over the circuit's qubits.
     * @throws UnsupportedOperationTypeException if any command uses another gate type.
     */
    Tableau circuitToTableau(Circuit circuit) throws UnsupportedOperationTypeException;

    /**
     * Synthesizes a canonical-form circuit that realises the tableau exactly.
     *
     * @param tableau The tableau to realise; it is not modified.
     * @return A new circuit over the tableau's qubit identifiers.
     * @throws InvalidTableauException if the stabilizers are not mutually independent, or the rows
     *         do not form a symplectic basis.
     */
    Circuit tableauToCircuit(Tableau tableau) throws InvalidTableauException;
}
