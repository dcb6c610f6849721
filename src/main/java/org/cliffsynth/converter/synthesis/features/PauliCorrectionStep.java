package org.cliffsynth.converter.synthesis.features;

import org.cliffsynth.circuit.OpType;
import org.cliffsynth.converter.synthesis.ISynthesisStep;
import org.cliffsynth.converter.synthesis.SynthesisContext;
import org.cliffsynth.converter.synthesis.SynthesisLayer;
import org.cliffsynth.tableau.Tableau;

/**
 * Clears the signs left once the X and Z parts of the residual are the identity: a Z flips
 * the sign of the destabilizer on its qubit, an X that of the stabilizer.
 */
public class PauliCorrectionStep implements ISynthesisStep {

    @Override
    public void apply(SynthesisContext context) {
        context.beginLayer(SynthesisLayer.PAULI_CORRECTION);
        Tableau residual = context.residual();
        for (int i = 0; i < context.size(); i++) {
            if (residual.getXpauliPhase(i)) {
                context.emit(OpType.Z, i);
            }
            if (residual.getZpauliPhase(i)) {
                context.emit(OpType.X, i);
            }
        }
    }
}
