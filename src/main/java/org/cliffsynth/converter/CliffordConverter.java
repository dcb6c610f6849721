package org.cliffsynth.converter;

import org.cliffsynth.api.InvalidTableauException;
import org.cliffsynth.api.TableauConverter;
import org.cliffsynth.api.UnsupportedOperationTypeException;
import org.cliffsynth.circuit.Circuit;
import org.cliffsynth.converter.synthesis.SynthesisRegistry;
import org.cliffsynth.converter.synthesis.TableauSynthesizer;
import org.cliffsynth.tableau.Tableau;

/**
 * Default {@link TableauConverter}: forward simulation plus canonical-form synthesis.
 * Stateless, so one instance can be shared.
 */
public class CliffordConverter implements TableauConverter {

    private final CircuitToTableauConverter forward;
    private final TableauSynthesizer synthesizer;

    public CliffordConverter() {
        this(new CircuitToTableauConverter(), new TableauSynthesizer(SynthesisRegistry.initializeWithDefaults()));
    }

    /**
     * @param forward The circuit to tableau converter.
     * @param synthesizer The tableau to circuit synthesizer.
     */
    public CliffordConverter(CircuitToTableauConverter forward, TableauSynthesizer synthesizer) {
        this.forward = forward;
        this.synthesizer = synthesizer;
    }

    @Override
    public Tableau circuitToTableau(Circuit circuit) throws UnsupportedOperationTypeException {
        return forward.convert(circuit);
    }

    @Override
    public Circuit tableauToCircuit(Tableau tableau) throws InvalidTableauException {
        return synthesizer.synthesize(tableau).circuit();
    }
}
