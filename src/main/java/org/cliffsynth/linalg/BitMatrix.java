package org.cliffsynth.linalg;

import java.util.Arrays;

/**
 * A dense matrix over GF(2).
 * <p>
 * Addition is exclusive or and multiplication is logical and. The data is stored in
 * row major form; element (r, c) is {@code data[r][c]}.
 */
public final class BitMatrix {

    private final int rows;
    private final int columns;
    private final boolean[][] data;

    /**
     * Initializes a matrix of zeros.
     *
     * @param rows The number of rows.
     * @param columns The number of columns.
     */
    public BitMatrix(int rows, int columns) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Matrix dimensions must be non-negative: " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.data = new boolean[rows][columns];
    }

    /**
     * Initializes a matrix with a deep copy of the given row-major data.
     *
     * @param initData The rows; all must have the same length.
     */
    public BitMatrix(boolean[][] initData) {
        this(initData.length, initData.length == 0 ? 0 : initData[0].length);
        for (int r = 0; r < rows; r++) {
            if (initData[r].length != columns) {
                throw new IllegalArgumentException("Not all rows have the same number of columns");
            }
            System.arraycopy(initData[r], 0, data[r], 0, columns);
        }
    }

    /**
     * Returns an identity matrix of the given size.
     * @param size The dimension.
     * @return The identity.
     */
    public static BitMatrix identity(int size) {
        BitMatrix result = new BitMatrix(size, size);
        for (int i = 0; i < size; i++) {
            result.data[i][i] = true;
        }
        return result;
    }

    /**
     * Parses rows written as strings of '0' and '1', e.g. {@code of("10", "01")}.
     * @param rowBits One string per row.
     * @return The matrix.
     */
    public static BitMatrix of(String... rowBits) {
        boolean[][] parsed = new boolean[rowBits.length][];
        for (int r = 0; r < rowBits.length; r++) {
            String row = rowBits[r];
            parsed[r] = new boolean[row.length()];
            for (int c = 0; c < row.length(); c++) {
                char ch = row.charAt(c);
                if (ch != '0' && ch != '1') {
                    throw new IllegalArgumentException("Unexpected character '" + ch + "' in row " + r);
                }
                parsed[r][c] = ch == '1';
            }
        }
        return new BitMatrix(parsed);
    }

    /**
     * @return A deep copy of this matrix.
     */
    public BitMatrix copy() {
        return new BitMatrix(data);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public boolean isSquare() {
        return rows == columns;
    }

    public boolean get(int r, int c) {
        checkIndex(r, c);
        return data[r][c];
    }

    public void set(int r, int c, boolean value) {
        checkIndex(r, c);
        data[r][c] = value;
    }

    /**
     * Flips the bit at (r, c).
     */
    public void flip(int r, int c) {
        checkIndex(r, c);
        data[r][c] ^= true;
    }

    /**
     * Returns a copy of one column.
     * @param c The column index.
     * @return The column as an array indexed by row.
     */
    public boolean[] column(int c) {
        checkColumn(c);
        boolean[] result = new boolean[rows];
        for (int r = 0; r < rows; r++) {
            result[r] = data[r][c];
        }
        return result;
    }

    /**
     * Overwrites one column.
     * @param c The column index.
     * @param values The new values, indexed by row.
     */
    public void setColumn(int c, boolean[] values) {
        if (values.length != rows) {
            throw new IllegalArgumentException("Column has " + values.length + " entries, expected " + rows);
        }
        for (int r = 0; r < rows; r++) {
            set(r, c, values[r]);
        }
    }

    /**
     * Returns a copy of one row.
     * @param r The row index.
     * @return The row as an array indexed by column.
     */
    public boolean[] row(int r) {
        if (r < 0 || rows <= r) {
            throw new IllegalArgumentException("Row index out of range: " + r);
        }
        return data[r].clone();
    }

    /**
     * Adds column {@code source} into column {@code target}.
     */
    public void xorColumnInto(int source, int target) {
        checkColumn(source);
        checkColumn(target);
        for (int r = 0; r < rows; r++) {
            data[r][target] ^= data[r][source];
        }
    }

    /**
     * Multiplies this matrix (the one on the left) by another matrix (the one on the right).
     */
    public BitMatrix times(BitMatrix right) {
        if (columns != right.rows) {
            throw new IllegalArgumentException(
                    "Columns on left (" + columns + ") is different than rows on right (" + right.rows + ")");
        }
        BitMatrix result = new BitMatrix(rows, right.columns);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < right.columns; c++) {
                boolean value = false;
                for (int i = 0; i < columns; i++) {
                    value ^= data[r][i] & right.data[i][c];
                }
                result.data[r][c] = value;
            }
        }
        return result;
    }

    /**
     * Returns the elementwise sum (exclusive or) of two matrices of equal shape.
     */
    public BitMatrix plus(BitMatrix other) {
        if (rows != other.rows || columns != other.columns) {
            throw new IllegalArgumentException("Matrices don't have the same shape");
        }
        BitMatrix result = new BitMatrix(rows, columns);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                result.data[r][c] = data[r][c] ^ other.data[r][c];
            }
        }
        return result;
    }

    public BitMatrix transpose() {
        BitMatrix result = new BitMatrix(columns, rows);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                result.data[c][r] = data[r][c];
            }
        }
        return result;
    }

    /**
     * Places {@code right} to the right of this matrix.
     */
    public BitMatrix augment(BitMatrix right) {
        if (rows != right.rows) {
            throw new IllegalArgumentException("Matrices don't have the same number of rows");
        }
        BitMatrix result = new BitMatrix(rows, columns + right.columns);
        for (int r = 0; r < rows; r++) {
            System.arraycopy(data[r], 0, result.data[r], 0, columns);
            System.arraycopy(right.data[r], 0, result.data[r], columns, right.columns);
        }
        return result;
    }

    public boolean isSymmetric() {
        if (!isSquare()) {
            return false;
        }
        for (int r = 0; r < rows; r++) {
            for (int c = r + 1; c < columns; c++) {
                if (data[r][c] != data[c][r]) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return The rank over GF(2).
     */
    public int rank() {
        boolean[][] work = new boolean[rows][];
        for (int r = 0; r < rows; r++) {
            work[r] = data[r].clone();
        }
        int rank = 0;
        for (int c = 0; c < columns && rank < rows; c++) {
            int pivot = -1;
            for (int r = rank; r < rows; r++) {
                if (work[r][c]) {
                    pivot = r;
                    break;
                }
            }
            if (pivot < 0) {
                continue;
            }
            boolean[] tmp = work[rank];
            work[rank] = work[pivot];
            work[pivot] = tmp;
            for (int r = 0; r < rows; r++) {
                if (r != rank && work[r][c]) {
                    for (int k = c; k < columns; k++) {
                        work[r][k] ^= work[rank][k];
                    }
                }
            }
            rank++;
        }
        return rank;
    }

    public boolean isInvertible() {
        return isSquare() && rank() == rows;
    }

    public boolean isIdentity() {
        return isSquare() && equals(identity(rows));
    }

    public boolean isZero() {
        for (boolean[] row : data) {
            for (boolean bit : row) {
                if (bit) {
                    return false;
                }
            }
        }
        return true;
    }

    private void checkIndex(int r, int c) {
        if (r < 0 || rows <= r) {
            throw new IllegalArgumentException("Row index out of range: " + r);
        }
        checkColumn(c);
    }

    private void checkColumn(int c) {
        if (c < 0 || columns <= c) {
            throw new IllegalArgumentException("Column index out of range: " + c);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof BitMatrix that)) return false;
        return rows == that.rows && columns == that.columns && Arrays.deepEquals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.deepHashCode(data);
    }

    /**
     * Returns the rows as strings of '0' and '1', e.g. {@code [10, 01]}.
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        result.append('[');
        for (int r = 0; r < rows; r++) {
            if (r != 0) {
                result.append(", ");
            }
            for (int c = 0; c < columns; c++) {
                result.append(data[r][c] ? '1' : '0');
            }
        }
        result.append(']');
        return result.toString();
    }
}
