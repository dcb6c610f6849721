package org.cliffsynth.linalg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gauss-Jordan elimination over GF(2) expressed as a sequence of column operations.
 */
public final class GaussianElimination {

    private GaussianElimination() {}

    /**
     * Computes column operations that reduce an invertible matrix to the identity.
     * <p>
     * Columns are processed in ascending order. If the diagonal entry of column {@code c}
     * is zero, the first later column with a one in row {@code c} is added into it. Then
     * column {@code c} is added into every other column with a one in row {@code c}, in
     * ascending order. Row {@code c} is never touched again afterwards, so the result is
     * fully determined by the input.
     *
     * @param matrix A square, invertible matrix. It is not modified.
     * @return The operations, in the order they must be applied.
     * @throws IllegalArgumentException if the matrix is not square or singular.
     */
    public static List<ColumnOperation> columnOperations(BitMatrix matrix) {
        if (!matrix.isSquare()) {
            throw new IllegalArgumentException(
                    "Only square matrices can be reduced, got " + matrix.rows() + "x" + matrix.columns());
        }
        BitMatrix work = matrix.copy();
        int n = work.rows();
        List<ColumnOperation> ops = new ArrayList<>();
        for (int c = 0; c < n; c++) {
            if (!work.get(c, c)) {
                int pivot = -1;
                for (int k = c + 1; k < n; k++) {
                    if (work.get(c, k)) {
                        pivot = k;
                        break;
                    }
                }
                if (pivot < 0) {
                    throw new IllegalArgumentException("Matrix is singular: " + matrix);
                }
                record(ops, work, new ColumnOperation(pivot, c));
            }
            for (int j = 0; j < n; j++) {
                if (j != c && work.get(c, j)) {
                    record(ops, work, new ColumnOperation(c, j));
                }
            }
        }
        return Collections.unmodifiableList(ops);
    }

    /**
     * Applies the operations to a copy of the matrix.
     *
     * @param matrix The matrix.
     * @param ops The operations, applied in list order.
     * @return The transformed copy.
     */
    public static BitMatrix apply(BitMatrix matrix, List<ColumnOperation> ops) {
        BitMatrix result = matrix.copy();
        for (ColumnOperation op : ops) {
            op.applyTo(result);
        }
        return result;
    }

    private static void record(List<ColumnOperation> ops, BitMatrix work, ColumnOperation op) {
        op.applyTo(work);
        ops.add(op);
    }
}
