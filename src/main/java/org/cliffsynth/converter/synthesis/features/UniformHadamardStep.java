package org.cliffsynth.converter.synthesis.features;

import org.cliffsynth.circuit.OpType;
import org.cliffsynth.converter.synthesis.ISynthesisStep;
import org.cliffsynth.converter.synthesis.SynthesisContext;
import org.cliffsynth.converter.synthesis.SynthesisLayer;

/**
 * Applies H to every qubit, exchanging the X and Z parts of all rows.
 */
public class UniformHadamardStep implements ISynthesisStep {

    @Override
    public void apply(SynthesisContext context) {
        context.beginLayer(SynthesisLayer.HADAMARD);
        for (int i = 0; i < context.size(); i++) {
            context.emit(OpType.H, i);
        }
    }
}
