package org.cliffsynth.converter.synthesis;

import org.cliffsynth.api.ConversionErrorCode;
import org.cliffsynth.api.InvalidTableauException;
import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.circuit.Qubit;
import org.cliffsynth.tableau.QubitIndexMap;
import org.cliffsynth.tableau.Tableau;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Synthesizes a canonical-form circuit from a tableau by running the registered
 * {@link ISynthesisStep}s on a private copy of it. Holds no per-call state.
 */
public class TableauSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(TableauSynthesizer.class);

    private final SynthesisRegistry registry;

    /**
     * @param registry The steps to run, in order.
     */
    public TableauSynthesizer(SynthesisRegistry registry) {
        this.registry = registry;
    }

    /**
     * Synthesizes a circuit realising the tableau.
     *
     * @param tableau The input; it is copied and never modified.
     * @return The circuit, renamed to the tableau's qubit identifiers, and per-layer statistics.
     * @throws InvalidTableauException if the stabilizers are not mutually independent, or the
     *         rows are otherwise not a symplectic basis.
     */
    public SynthesisResult synthesize(Tableau tableau) throws InvalidTableauException {
        SynthesisContext context = new SynthesisContext(new Tableau(tableau));
        for (ISynthesisStep step : registry.steps()) {
            step.apply(context);
        }
        if (!context.residual().equals(new Tableau(tableau.getQubits().qubits()))) {
            throw new InvalidTableauException(ConversionErrorCode.NOT_SYMPLECTIC,
                    "Tableau rows do not form a symplectic basis; residual after synthesis:\n" + context.residual());
        }
        if (LOG.isDebugEnabled()) {
            context.layerCounts().forEach((layer, count) -> LOG.debug("Layer {}: {} gate(s)", layer, count));
            LOG.debug("Synthesized {} gate(s) for {} qubit(s)", context.circuit().size(), tableau.size());
        }

        Circuit circuit = context.circuit();
        QubitIndexMap qubits = tableau.getQubits();
        Map<Qubit, Qubit> renaming = new HashMap<>();
        for (int i = 0; i < qubits.size(); i++) {
            renaming.put(Qubit.of(i), qubits.qubitAt(i));
        }
        circuit.renameUnits(renaming);
        return new SynthesisResult(circuit, context.layerCounts());
    }
}
