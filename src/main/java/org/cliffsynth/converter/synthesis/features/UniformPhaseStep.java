package org.cliffsynth.converter.synthesis.features;

import org.cliffsynth.circuit.OpType;
import org.cliffsynth.converter.synthesis.ISynthesisStep;
import org.cliffsynth.converter.synthesis.SynthesisContext;
import org.cliffsynth.converter.synthesis.SynthesisLayer;

/**
 * Applies S to every qubit, turning a row block {@code (M M)} into {@code (M 0)}.
 * Signs are left for {@link PauliCorrectionStep}.
 */
public class UniformPhaseStep implements ISynthesisStep {

    private final SynthesisLayer layer;

    /**
     * @param layer The layer the S gates are counted towards.
     */
    public UniformPhaseStep(SynthesisLayer layer) {
        this.layer = layer;
    }

    @Override
    public void apply(SynthesisContext context) {
        context.beginLayer(layer);
        for (int i = 0; i < context.size(); i++) {
            context.emit(OpType.S, i);
        }
    }
}
