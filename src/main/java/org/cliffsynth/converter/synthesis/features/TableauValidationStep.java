package org.cliffsynth.converter.synthesis.features;

import org.cliffsynth.api.ConversionErrorCode;
import org.cliffsynth.api.InvalidTableauException;
import org.cliffsynth.converter.synthesis.ISynthesisStep;
import org.cliffsynth.converter.synthesis.SynthesisContext;
import org.cliffsynth.linalg.BitMatrix;
import org.cliffsynth.tableau.Tableau;

/**
 * Rejects tableaux without a circuit realisation before any gate is emitted.
 * <p>
 * The stabilizer rows {@code (C | D)} must have full rank. All rows together must satisfy the
 * Pauli commutation relations, i.e. with blocks {@code (A B; C D)}:
 * {@code A B^T + B A^T = 0}, {@code C D^T + D C^T = 0} and {@code A D^T + B C^T = I}.
 */
public class TableauValidationStep implements ISynthesisStep {

    @Override
    public void apply(SynthesisContext context) throws InvalidTableauException {
        Tableau residual = context.residual();
        BitMatrix a = residual.getXpauliX();
        BitMatrix b = residual.getXpauliZ();
        BitMatrix c = residual.getZpauliX();
        BitMatrix d = residual.getZpauliZ();

        int rank = c.augment(d).rank();
        if (rank < context.size()) {
            throw new InvalidTableauException(ConversionErrorCode.STABILIZERS_NOT_INDEPENDENT,
                    "Stabilizers are not mutually independent (rank " + rank + " of " + context.size() + ")");
        }
        if (!isZeroForm(a, b) || !isZeroForm(c, d)
                || !a.times(d.transpose()).plus(b.times(c.transpose())).isIdentity()) {
            throw new InvalidTableauException(ConversionErrorCode.NOT_SYMPLECTIC,
                    "Tableau rows do not satisfy the Pauli commutation relations:\n" + residual);
        }
    }

    /**
     * Whether all rows of {@code (x | z)} commute pairwise.
     */
    private static boolean isZeroForm(BitMatrix x, BitMatrix z) {
        return x.times(z.transpose()).plus(z.times(x.transpose())).isZero();
    }
}
