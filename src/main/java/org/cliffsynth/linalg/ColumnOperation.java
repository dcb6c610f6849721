package org.cliffsynth.linalg;

/**
 * An elementary column operation over GF(2): column {@code control} is added into
 * column {@code target}. Applied to a tableau it is a CX gate with the same control
 * and target.
 *
 * @param control The column that is read.
 * @param target The column that is modified.
 */
public record ColumnOperation(int control, int target) {

    public ColumnOperation {
        if (control < 0 || target < 0) {
            throw new IllegalArgumentException("Column indices must be non-negative");
        }
        if (control == target) {
            throw new IllegalArgumentException("A column cannot be added into itself: " + control);
        }
    }

    /**
     * Applies this operation to the matrix in place.
     * @param matrix The matrix to modify.
     */
    public void applyTo(BitMatrix matrix) {
        matrix.xorColumnInto(control, target);
    }
}
