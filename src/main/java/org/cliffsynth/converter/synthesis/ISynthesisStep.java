package org.cliffsynth.converter.synthesis;

import org.cliffsynth.api.InvalidTableauException;

/**
 * One stage of canonical-form synthesis. Steps run in registry order on a shared
 * {@link SynthesisContext}; each may rely on the structure established by the previous ones.
 */
public interface ISynthesisStep {

    /**
     * Emits this step's gates and updates the residual tableau accordingly.
     *
     * @param context The synthesis state.
     * @throws InvalidTableauException if the residual shows the input was not a valid tableau.
     */
    void apply(SynthesisContext context) throws InvalidTableauException;
}
