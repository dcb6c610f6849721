package org.cliffsynth.converter.synthesis.features;

import org.cliffsynth.api.ConversionErrorCode;
import org.cliffsynth.api.InvalidTableauException;
import org.cliffsynth.circuit.OpType;
import org.cliffsynth.converter.synthesis.ISynthesisStep;
import org.cliffsynth.converter.synthesis.SynthesisContext;
import org.cliffsynth.converter.synthesis.SynthesisLayer;
import org.cliffsynth.converter.synthesis.TableauBlock;
import org.cliffsynth.linalg.BitMatrix;

import java.util.HashMap;
import java.util.Map;

/**
 * Makes the X part of the stabilizers full rank by applying V to qubits whose column is
 * dependent on the columns to its left.
 * <p>
 * The columns of {@link TableauBlock#STABILIZER_X} are reduced one at a time against the
 * leading rows of the already accepted columns. A V on qubit {@code i} adds column {@code i}
 * of {@link TableauBlock#STABILIZER_Z} into that column, so a dependent column is retried with
 * the Z column instead. For a validated tableau the retry always succeeds.
 */
public class RankFixStep implements ISynthesisStep {

    @Override
    public void apply(SynthesisContext context) throws InvalidTableauException {
        context.beginLayer(SynthesisLayer.RANK_FIX);
        int size = context.size();
        BitMatrix echelon = TableauBlock.STABILIZER_X.read(context.residual());
        Map<Integer, Integer> leadingRowToColumn = new HashMap<>();
        for (int i = 0; i < size; i++) {
            if (reduceColumn(echelon, i, leadingRowToColumn)) {
                continue;
            }
            context.emit(OpType.V, i);
            echelon.setColumn(i, TableauBlock.STABILIZER_Z.read(context.residual()).column(i));
            if (!reduceColumn(echelon, i, leadingRowToColumn)) {
                throw new InvalidTableauException(ConversionErrorCode.NOT_SYMPLECTIC,
                        "Stabilizer X part cannot be made full rank at qubit index " + i);
            }
        }
    }

    /**
     * Reduces column {@code col} against the accepted columns, scanning rows top to bottom.
     *
     * @return {@code true} if the column is independent and was accepted.
     */
    private static boolean reduceColumn(BitMatrix echelon, int col, Map<Integer, Integer> leadingRowToColumn) {
        for (int row = 0; row < echelon.rows(); row++) {
            if (!echelon.get(row, col)) {
                continue;
            }
            Integer owner = leadingRowToColumn.get(row);
            if (owner == null) {
                leadingRowToColumn.put(row, col);
                return true;
            }
            echelon.xorColumnInto(owner, col);
        }
        return false;
    }
}
