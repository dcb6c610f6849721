package org.cliffsynth.tableau;

import org.cliffsynth.api.UnsupportedOperationTypeException;
import org.cliffsynth.circuit.OpType;
import org.cliffsynth.circuit.Qubit;
import org.cliffsynth.linalg.BitMatrix;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Symplectic summary of a Clifford unitary {@code U} over {@code n} qubits.
 * <p>
 * For every qubit index {@code i} the tableau stores two signed Pauli strings: the
 * destabilizer row {@code U X_i U^dagger} (in {@code xpauli*}) and the stabilizer row
 * {@code U Z_i U^dagger} (in {@code zpauli*}), following Aaronson and Gottesman. Rows are
 * generators, columns are qubit indices. For a state prepared from {@code |0...0>} the
 * stabilizer rows generate its stabilizer group.
 * <p>
 * Two families of updates exist per generator gate:
 * <ul>
 *   <li><b>at end</b> ({@code U' = G U}, the gate runs after the circuit) conjugates the
 *       affected columns of every row by {@code G},</li>
 *   <li><b>at front</b> ({@code U' = U G}, the gate runs before the circuit) replaces the
 *       generator rows by the rows of {@code G X_q G^dagger} and {@code G Z_q G^dagger}.</li>
 * </ul>
 * Instances are mutable and not thread-safe; use the copy constructor to obtain an
 * independent working copy.
 */
public final class Tableau {

    private final int size;
    private final BitMatrix xpauliX;
    private final BitMatrix xpauliZ;
    private final boolean[] xpauliPhase;
    private final BitMatrix zpauliX;
    private final BitMatrix zpauliZ;
    private final boolean[] zpauliPhase;
    private final QubitIndexMap qubits;

    /**
     * Creates the identity tableau over {@code q[0] .. q[n-1]}.
     * @param n The qubit count.
     */
    public Tableau(int n) {
        this(defaultQubits(n));
    }

    /**
     * Creates the identity tableau over the given qubits.
     * @param qubits The qubits; their iteration order defines the indices.
     */
    public Tableau(Collection<Qubit> qubits) {
        this.qubits = new QubitIndexMap(qubits);
        this.size = this.qubits.size();
        this.xpauliX = BitMatrix.identity(size);
        this.xpauliZ = new BitMatrix(size, size);
        this.xpauliPhase = new boolean[size];
        this.zpauliX = new BitMatrix(size, size);
        this.zpauliZ = BitMatrix.identity(size);
        this.zpauliPhase = new boolean[size];
    }

    /**
     * Deep copy.
     * @param other The tableau to copy.
     */
    public Tableau(Tableau other) {
        this.size = other.size;
        this.qubits = other.qubits;
        this.xpauliX = other.xpauliX.copy();
        this.xpauliZ = other.xpauliZ.copy();
        this.xpauliPhase = other.xpauliPhase.clone();
        this.zpauliX = other.zpauliX.copy();
        this.zpauliZ = other.zpauliZ.copy();
        this.zpauliPhase = other.zpauliPhase.clone();
    }

    /**
     * Builds a tableau directly from its rows. No validity check is performed; a set of
     * rows that is not a symplectic basis is rejected later by synthesis.
     *
     * @param qubits The qubits, defining indices by iteration order.
     * @param destabilizers One Pauli string per qubit, the image attached to X.
     * @param stabilizers One Pauli string per qubit, the image attached to Z.
     * @return The tableau.
     */
    public static Tableau fromPauliStrings(Collection<Qubit> qubits, List<PauliString> destabilizers,
                                           List<PauliString> stabilizers) {
        Tableau tab = new Tableau(qubits);
        if (destabilizers.size() != tab.size || stabilizers.size() != tab.size) {
            throw new IllegalArgumentException("Expected " + tab.size + " destabilizers and stabilizers, got "
                    + destabilizers.size() + " and " + stabilizers.size());
        }
        for (int row = 0; row < tab.size; row++) {
            tab.loadRow(tab.xpauliX, tab.xpauliZ, tab.xpauliPhase, row, destabilizers.get(row));
            tab.loadRow(tab.zpauliX, tab.zpauliZ, tab.zpauliPhase, row, stabilizers.get(row));
        }
        return tab;
    }

    private void loadRow(BitMatrix xs, BitMatrix zs, boolean[] phases, int row, PauliString pauli) {
        if (pauli.size() != size) {
            throw new IllegalArgumentException("Pauli string " + pauli + " does not have " + size + " qubits");
        }
        for (int col = 0; col < size; col++) {
            xs.set(row, col, pauli.get(col).x());
            zs.set(row, col, pauli.get(col).z());
        }
        phases[row] = pauli.negative();
    }

    private static List<Qubit> defaultQubits(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Qubit count must be non-negative: " + n);
        }
        List<Qubit> qubits = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            qubits.add(Qubit.of(i));
        }
        return qubits;
    }

    // region Accessors

    public int size() {
        return size;
    }

    public QubitIndexMap getQubits() {
        return qubits;
    }

    /** @return A copy of the X part of the destabilizer rows. */
    public BitMatrix getXpauliX() {
        return xpauliX.copy();
    }

    /** @return A copy of the Z part of the destabilizer rows. */
    public BitMatrix getXpauliZ() {
        return xpauliZ.copy();
    }

    /** @return A copy of the X part of the stabilizer rows. */
    public BitMatrix getZpauliX() {
        return zpauliX.copy();
    }

    /** @return A copy of the Z part of the stabilizer rows. */
    public BitMatrix getZpauliZ() {
        return zpauliZ.copy();
    }

    public boolean getXpauliPhase(int row) {
        return xpauliPhase[row];
    }

    public boolean getZpauliPhase(int row) {
        return zpauliPhase[row];
    }

    /**
     * @param qubit A qubit of the tableau.
     * @return The destabilizer row attached to X on that qubit.
     */
    public PauliString getDestabilizer(Qubit qubit) {
        return readRow(xpauliX, xpauliZ, xpauliPhase, qubits.indexOf(qubit));
    }

    /**
     * @param qubit A qubit of the tableau.
     * @return The stabilizer row attached to Z on that qubit.
     */
    public PauliString getStabilizer(Qubit qubit) {
        return readRow(zpauliX, zpauliZ, zpauliPhase, qubits.indexOf(qubit));
    }

    private PauliString readRow(BitMatrix xs, BitMatrix zs, boolean[] phases, int row) {
        List<Pauli> paulis = new ArrayList<>(size);
        for (int col = 0; col < size; col++) {
            paulis.add(Pauli.fromBits(xs.get(row, col), zs.get(row, col)));
        }
        return new PauliString(phases[row], paulis);
    }

    // endregion

    // region Gate dispatch

    /**
     * Applies a generating-set gate after the summarised circuit.
     *
     * @param type The gate type.
     * @param indices The qubit indices, in gate order.
     * @throws UnsupportedOperationTypeException for gates outside {H, V, S, CX, X, Z}.
     */
    public void applyGateAtEnd(OpType type, List<Integer> indices) throws UnsupportedOperationTypeException {
        checkArity(type, indices);
        switch (type) {
            case H -> {
                applySAtEnd(indices.get(0));
                applyVAtEnd(indices.get(0));
                applySAtEnd(indices.get(0));
            }
            case V -> applyVAtEnd(indices.get(0));
            case S -> applySAtEnd(indices.get(0));
            case X -> {
                applyVAtEnd(indices.get(0));
                applyVAtEnd(indices.get(0));
            }
            case Z -> {
                applySAtEnd(indices.get(0));
                applySAtEnd(indices.get(0));
            }
            case CX -> applyCXAtEnd(indices.get(0), indices.get(1));
            default -> throw new UnsupportedOperationTypeException(type);
        }
    }

    /**
     * Applies a generating-set gate before the summarised circuit.
     *
     * @param type The gate type.
     * @param indices The qubit indices, in gate order.
     * @throws UnsupportedOperationTypeException for gates outside {H, V, S, CX, X, Z}.
     */
    public void applyGateAtFront(OpType type, List<Integer> indices) throws UnsupportedOperationTypeException {
        checkArity(type, indices);
        switch (type) {
            case H -> {
                applySAtFront(indices.get(0));
                applyVAtFront(indices.get(0));
                applySAtFront(indices.get(0));
            }
            case V -> applyVAtFront(indices.get(0));
            case S -> applySAtFront(indices.get(0));
            case X -> {
                applyVAtFront(indices.get(0));
                applyVAtFront(indices.get(0));
            }
            case Z -> {
                applySAtFront(indices.get(0));
                applySAtFront(indices.get(0));
            }
            case CX -> applyCXAtFront(indices.get(0), indices.get(1));
            default -> throw new UnsupportedOperationTypeException(type);
        }
    }

    private static void checkArity(OpType type, List<Integer> indices) {
        if (indices.size() != type.arity()) {
            throw new IllegalArgumentException(
                    type + " expects " + type.arity() + " qubit index(es) but got " + indices);
        }
    }

    // endregion

    // region Updates at end (column conjugation)

    /**
     * {@code U' = S U}: every row is conjugated by S on {@code qb}
     * ({@code X -> Y}, {@code Y -> -X}, {@code Z -> Z}).
     */
    public void applySAtEnd(int qb) {
        checkQubit(qb);
        conjugateS(xpauliX, xpauliZ, xpauliPhase, qb);
        conjugateS(zpauliX, zpauliZ, zpauliPhase, qb);
    }

    private void conjugateS(BitMatrix xs, BitMatrix zs, boolean[] phases, int qb) {
        for (int row = 0; row < size; row++) {
            boolean x = xs.get(row, qb);
            boolean z = zs.get(row, qb);
            phases[row] ^= x && z;
            zs.set(row, qb, z ^ x);
        }
    }

    /**
     * {@code U' = V U}: every row is conjugated by V on {@code qb}
     * ({@code X -> X}, {@code Z -> -Y}, {@code Y -> Z}).
     */
    public void applyVAtEnd(int qb) {
        checkQubit(qb);
        conjugateV(xpauliX, xpauliZ, xpauliPhase, qb);
        conjugateV(zpauliX, zpauliZ, zpauliPhase, qb);
    }

    private void conjugateV(BitMatrix xs, BitMatrix zs, boolean[] phases, int qb) {
        for (int row = 0; row < size; row++) {
            boolean x = xs.get(row, qb);
            boolean z = zs.get(row, qb);
            phases[row] ^= z && !x;
            xs.set(row, qb, x ^ z);
        }
    }

    /**
     * {@code U' = CX U}: every row is conjugated by CX on {@code (control, target)}.
     */
    public void applyCXAtEnd(int control, int target) {
        checkPair(control, target);
        conjugateCX(xpauliX, xpauliZ, xpauliPhase, control, target);
        conjugateCX(zpauliX, zpauliZ, zpauliPhase, control, target);
    }

    private void conjugateCX(BitMatrix xs, BitMatrix zs, boolean[] phases, int control, int target) {
        for (int row = 0; row < size; row++) {
            boolean xc = xs.get(row, control);
            boolean zc = zs.get(row, control);
            boolean xt = xs.get(row, target);
            boolean zt = zs.get(row, target);
            phases[row] ^= xc && zt && (xt == zc);
            xs.set(row, target, xt ^ xc);
            zs.set(row, control, zc ^ zt);
        }
    }

    // endregion

    // region Updates at front (row operations)

    /**
     * {@code U' = U S}: since {@code S X S^dagger = i X Z}, the destabilizer on {@code qb}
     * becomes {@code i X_qb Z_qb} in terms of the old rows.
     */
    public void applySAtFront(int qb) {
        checkQubit(qb);
        multiplyRows(1, xpauliX, xpauliZ, xpauliPhase, qb, zpauliX, zpauliZ, zpauliPhase, qb,
                xpauliX, xpauliZ, xpauliPhase, qb);
    }

    /**
     * {@code U' = U V}: since {@code V Z V^dagger = -i X Z}, the stabilizer on {@code qb}
     * becomes {@code -i X_qb Z_qb} in terms of the old rows.
     */
    public void applyVAtFront(int qb) {
        checkQubit(qb);
        multiplyRows(3, xpauliX, xpauliZ, xpauliPhase, qb, zpauliX, zpauliZ, zpauliPhase, qb,
                zpauliX, zpauliZ, zpauliPhase, qb);
    }

    /**
     * {@code U' = U CX}: {@code X_control -> X_control X_target} and {@code Z_target -> Z_control Z_target}.
     */
    public void applyCXAtFront(int control, int target) {
        checkPair(control, target);
        multiplyRows(0, xpauliX, xpauliZ, xpauliPhase, control, xpauliX, xpauliZ, xpauliPhase, target,
                xpauliX, xpauliZ, xpauliPhase, control);
        multiplyRows(0, zpauliX, zpauliZ, zpauliPhase, control, zpauliX, zpauliZ, zpauliPhase, target,
                zpauliX, zpauliZ, zpauliPhase, target);
    }

    /**
     * Writes {@code i^k * left * right} into the destination row, which must be one of the operands.
     */
    private void multiplyRows(int k,
                              BitMatrix lx, BitMatrix lz, boolean[] lPhase, int lRow,
                              BitMatrix rx, BitMatrix rz, boolean[] rPhase, int rRow,
                              BitMatrix dx, BitMatrix dz, boolean[] dPhase, int dRow) {
        int exponent = k + (lPhase[lRow] ? 2 : 0) + (rPhase[rRow] ? 2 : 0);
        boolean[] xs = new boolean[size];
        boolean[] zs = new boolean[size];
        for (int col = 0; col < size; col++) {
            boolean x1 = lx.get(lRow, col);
            boolean z1 = lz.get(lRow, col);
            boolean x2 = rx.get(rRow, col);
            boolean z2 = rz.get(rRow, col);
            exponent += productPhase(x1, z1, x2, z2);
            xs[col] = x1 ^ x2;
            zs[col] = z1 ^ z2;
        }
        exponent = Math.floorMod(exponent, 4);
        if (exponent % 2 != 0) {
            throw new IllegalStateException("Row product is not Hermitian; the tableau rows do not satisfy the Pauli relations");
        }
        for (int col = 0; col < size; col++) {
            dx.set(dRow, col, xs[col]);
            dz.set(dRow, col, zs[col]);
        }
        dPhase[dRow] = exponent == 2;
    }

    /**
     * Power of {@code i} picked up by the single-qubit product {@code P(x1, z1) * P(x2, z2)}.
     */
    private static int productPhase(boolean x1, boolean z1, boolean x2, boolean z2) {
        if (x1 && z1) {
            return (z2 ? 1 : 0) - (x2 ? 1 : 0);
        }
        if (x1) {
            return z2 ? (x2 ? 1 : -1) : 0;
        }
        if (z1) {
            return x2 ? (z2 ? -1 : 1) : 0;
        }
        return 0;
    }

    // endregion

    private void checkQubit(int qb) {
        if (qb < 0 || qb >= size) {
            throw new IllegalArgumentException("Qubit index out of range: " + qb);
        }
    }

    private void checkPair(int control, int target) {
        checkQubit(control);
        checkQubit(target);
        if (control == target) {
            throw new IllegalArgumentException("CX control and target must differ: " + control);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tableau that)) return false;
        return size == that.size
                && qubits.equals(that.qubits)
                && xpauliX.equals(that.xpauliX)
                && xpauliZ.equals(that.xpauliZ)
                && Arrays.equals(xpauliPhase, that.xpauliPhase)
                && zpauliX.equals(that.zpauliX)
                && zpauliZ.equals(that.zpauliZ)
                && Arrays.equals(zpauliPhase, that.zpauliPhase);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(size, qubits, xpauliX, xpauliZ, zpauliX, zpauliZ);
        result = 31 * result + Arrays.hashCode(xpauliPhase);
        return 31 * result + Arrays.hashCode(zpauliPhase);
    }

    /**
     * One line per generator, e.g. {@code X@q[0] -> +XZ}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < size; i++) {
            sb.append("X@").append(qubits.qubitAt(i)).append(" -> ")
                    .append(readRow(xpauliX, xpauliZ, xpauliPhase, i)).append('\n');
        }
        for (int i = 0; i < size; i++) {
            sb.append("Z@").append(qubits.qubitAt(i)).append(" -> ")
                    .append(readRow(zpauliX, zpauliZ, zpauliPhase, i)).append('\n');
        }
        return sb.toString();
    }
}
