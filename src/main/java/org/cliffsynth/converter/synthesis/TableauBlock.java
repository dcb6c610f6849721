package org.cliffsynth.converter.synthesis;

import org.cliffsynth.linalg.BitMatrix;
import org.cliffsynth.tableau.Tableau;

/**
 * Selects one of the four n x n blocks of the inverse map {@code P -> U^dagger P U} of a
 * tableau for {@code U}.
 * <p>
 * Prepending a gate to {@code U} combines generator rows of the tableau, which acts on these
 * blocks as column operations: a CX on {@code (c, t)} adds column {@code c} of
 * {@link #STABILIZER_X} into column {@code t}. For a valid tableau with blocks
 * {@code (A B; C D)} the inverse blocks are {@code (D^T B^T; C^T A^T)}.
 */
public enum TableauBlock {
    DESTABILIZER_X,
    DESTABILIZER_Z,
    STABILIZER_X,
    STABILIZER_Z;

    /**
     * @param tableau The tableau.
     * @return A copy of the selected block of the inverse map.
     */
    public BitMatrix read(Tableau tableau) {
        return switch (this) {
            case DESTABILIZER_X -> tableau.getZpauliZ().transpose();
            case DESTABILIZER_Z -> tableau.getXpauliZ().transpose();
            case STABILIZER_X -> tableau.getZpauliX().transpose();
            case STABILIZER_Z -> tableau.getXpauliX().transpose();
        };
    }
}
