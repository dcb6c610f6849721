package org.cliffsynth.converter;

import org.cliffsynth.api.UnsupportedOperationTypeException;
import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.circuit.Command;
import org.cliffsynth.circuit.Qubit;
import org.cliffsynth.tableau.QubitIndexMap;
import org.cliffsynth.tableau.Tableau;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Simulates a circuit on the identity tableau, one command at a time in circuit order.
 */
public class CircuitToTableauConverter {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitToTableauConverter.class);

    /**
     * Converts the circuit. The circuit is not modified.
     *
     * @param circuit A circuit over {H, V, S, CX, X, Z}.
     * @return A new tableau over {@code circuit.allQubits()}.
     * @throws UnsupportedOperationTypeException if a command uses any other gate type.
     */
    public Tableau convert(Circuit circuit) throws UnsupportedOperationTypeException {
        Tableau tab = new Tableau(circuit.allQubits());
        QubitIndexMap qubits = tab.getQubits();
        for (Command com : circuit.getCommands()) {
            List<Integer> indices = new ArrayList<>(com.args().size());
            for (Qubit qb : com.args()) {
                indices.add(qubits.indexOf(qb));
            }
            tab.applyGateAtEnd(com.type(), indices);
        }
        LOG.debug("Converted circuit with {} command(s) on {} qubit(s) to a tableau",
                circuit.size(), circuit.nQubits());
        return tab;
    }
}
