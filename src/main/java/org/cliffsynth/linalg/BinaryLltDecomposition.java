package org.cliffsynth.linalg;

/**
 * GF(2) analogue of the Cholesky factorisation for symmetric matrices.
 * <p>
 * Not every symmetric binary matrix is of the form {@code M * M^T}, but every one is after
 * flipping some diagonal entries. The decomposition picks a lower unitriangular {@code M}
 * that matches all off-diagonal entries and reports the diagonal entries it could not match.
 */
public final class BinaryLltDecomposition {

    private BinaryLltDecomposition() {}

    /**
     * Decomposes a symmetric matrix.
     *
     * @param matrix A square symmetric matrix. It is not modified.
     * @return {@code (M, diag)} with {@code matrix = M * M^T + diag(diag)}.
     * @throws IllegalArgumentException if the matrix is not symmetric.
     */
    public static LltDecomposition decompose(BitMatrix matrix) {
        if (!matrix.isSymmetric()) {
            throw new IllegalArgumentException("Binary LLT decomposition requires a symmetric matrix: " + matrix);
        }
        int n = matrix.rows();
        BitMatrix l = new BitMatrix(n, n);
        for (int j = 0; j < n; j++) {
            l.set(j, j, true);
            for (int i = j + 1; i < n; i++) {
                // (L L^T)(i, j) = L(i, j) + sum_{k<j} L(i, k) L(j, k)
                boolean sum = false;
                for (int k = 0; k < j; k++) {
                    sum ^= l.get(i, k) & l.get(j, k);
                }
                l.set(i, j, matrix.get(i, j) ^ sum);
            }
        }
        boolean[] diagonal = new boolean[n];
        for (int i = 0; i < n; i++) {
            boolean product = false;
            for (int k = 0; k <= i; k++) {
                product ^= l.get(i, k);
            }
            diagonal[i] = matrix.get(i, i) ^ product;
        }
        return new LltDecomposition(l, diagonal);
    }
}
