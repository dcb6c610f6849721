package org.cliffsynth.converter.synthesis;

import org.cliffsynth.converter.synthesis.features.GaussianEliminationStep;
import org.cliffsynth.converter.synthesis.features.PauliCorrectionStep;
import org.cliffsynth.converter.synthesis.features.RankFixStep;
import org.cliffsynth.converter.synthesis.features.SymmetricFactorStep;
import org.cliffsynth.converter.synthesis.features.TableauValidationStep;
import org.cliffsynth.converter.synthesis.features.UniformHadamardStep;
import org.cliffsynth.converter.synthesis.features.UniformPhaseStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registry for synthesis steps applied in order.
 */
public final class SynthesisRegistry {

    private final List<ISynthesisStep> steps = new ArrayList<>();

    /**
     * Registers a new step after the existing ones.
     * @param step The step to register.
     */
    public void register(ISynthesisStep step) { steps.add(step); }

    /**
     * @return The registered steps, in execution order.
     */
    public List<ISynthesisStep> steps() { return Collections.unmodifiableList(steps); }

    /**
     * Initializes a registry with the canonical-form steps
     * (Aaronson and Gottesman, "Improved Simulation of Stabilizer Circuits", Theorem 8).
     * @return A new registry with default steps.
     */
    public static SynthesisRegistry initializeWithDefaults() {
        SynthesisRegistry reg = new SynthesisRegistry();
        reg.register(new TableauValidationStep());
        // blocks below are those of the inverse map, see TableauBlock
        // / A B \
        // \ C D /  -> C full rank
        reg.register(new RankFixStep());
        // C -> I
        reg.register(new GaussianEliminationStep(SynthesisLayer.ELIMINATE_STABILIZER_X, TableauBlock.STABILIZER_X));
        // D symmetric -> D = M M^T, then (I D) -> (M M)
        reg.register(new SymmetricFactorStep(SynthesisLayer.STABILIZER_DIAGONAL, SynthesisLayer.STABILIZER_FACTOR,
                TableauBlock.STABILIZER_Z));
        // (M M) -> (M 0)
        reg.register(new UniformPhaseStep(SynthesisLayer.STABILIZER_PHASE));
        // (M 0) -> (I 0), which forces B = I
        reg.register(new GaussianEliminationStep(SynthesisLayer.ELIMINATE_STABILIZER_FACTOR, TableauBlock.STABILIZER_X));
        // / A I \     / I A \
        // \ I 0 /  -> \ 0 I /
        reg.register(new UniformHadamardStep());
        // A symmetric -> A = N N^T, then (I A) -> (N N)
        reg.register(new SymmetricFactorStep(SynthesisLayer.DESTABILIZER_DIAGONAL, SynthesisLayer.DESTABILIZER_FACTOR,
                TableauBlock.DESTABILIZER_Z));
        // (N N) -> (N 0)
        reg.register(new UniformPhaseStep(SynthesisLayer.DESTABILIZER_PHASE));
        // N -> I
        reg.register(new GaussianEliminationStep(SynthesisLayer.ELIMINATE_DESTABILIZER_X, TableauBlock.DESTABILIZER_X));
        // remaining signs
        reg.register(new PauliCorrectionStep());
        return reg;
    }
}
