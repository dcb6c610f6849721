package org.cliffsynth.linalg;

/**
 * Result of a binary LLT decomposition: {@code D = factor * factor^T + diag(diagonal)}.
 *
 * @param factor An invertible (lower unitriangular) matrix.
 * @param diagonal The diagonal correction; entry {@code i} set means D and
 *                 {@code factor * factor^T} differ at (i, i).
 */
public record LltDecomposition(BitMatrix factor, boolean[] diagonal) {

    public LltDecomposition {
        diagonal = diagonal.clone();
    }

    @Override
    public boolean[] diagonal() {
        return diagonal.clone();
    }

    /**
     * @param i A row index.
     * @return Whether the diagonal correction is set at (i, i).
     */
    public boolean correctionAt(int i) {
        return diagonal[i];
    }

    /**
     * Rebuilds {@code factor * factor^T + diag(diagonal)}.
     */
    public BitMatrix reconstruct() {
        BitMatrix product = factor.times(factor.transpose());
        for (int i = 0; i < diagonal.length; i++) {
            if (diagonal[i]) {
                product.flip(i, i);
            }
        }
        return product;
    }
}
