package org.cliffsynth.converter.synthesis.features;

import org.cliffsynth.api.ConversionErrorCode;
import org.cliffsynth.api.InvalidTableauException;
import org.cliffsynth.circuit.OpType;
import org.cliffsynth.converter.synthesis.ISynthesisStep;
import org.cliffsynth.converter.synthesis.SynthesisContext;
import org.cliffsynth.converter.synthesis.SynthesisLayer;
import org.cliffsynth.converter.synthesis.TableauBlock;
import org.cliffsynth.linalg.BinaryLltDecomposition;
import org.cliffsynth.linalg.BitMatrix;
import org.cliffsynth.linalg.ColumnOperation;
import org.cliffsynth.linalg.GaussianElimination;
import org.cliffsynth.linalg.LltDecomposition;

import java.util.List;

/**
 * Turns a row block {@code (I D)} with symmetric {@code D} into {@code (M M)}.
 * <p>
 * S gates fix the diagonal so that {@code D = M M^T} for an invertible {@code M}. The column
 * operations reducing {@code M} to the identity, emitted as CX in reverse order, map the X
 * part {@code I} to {@code M} and the Z part {@code M M^T} to {@code M M^T (M^T)^-1 = M}.
 */
public class SymmetricFactorStep implements ISynthesisStep {

    private final SynthesisLayer diagonalLayer;
    private final SynthesisLayer factorLayer;
    private final TableauBlock block;

    /**
     * @param diagonalLayer The layer the S gates are counted towards.
     * @param factorLayer The layer the CX gates are counted towards.
     * @param block The Z block holding {@code D}.
     */
    public SymmetricFactorStep(SynthesisLayer diagonalLayer, SynthesisLayer factorLayer, TableauBlock block) {
        this.diagonalLayer = diagonalLayer;
        this.factorLayer = factorLayer;
        this.block = block;
    }

    @Override
    public void apply(SynthesisContext context) throws InvalidTableauException {
        BitMatrix d = block.read(context.residual());
        if (!d.isSymmetric()) {
            throw new InvalidTableauException(ConversionErrorCode.NOT_SYMPLECTIC,
                    "Block " + block + " must be symmetric for commuting generators: " + d);
        }
        LltDecomposition llt = BinaryLltDecomposition.decompose(d);

        context.beginLayer(diagonalLayer);
        for (int i = 0; i < context.size(); i++) {
            if (llt.correctionAt(i)) {
                context.emit(OpType.S, i);
            }
        }

        context.beginLayer(factorLayer);
        List<ColumnOperation> toIdentity = GaussianElimination.columnOperations(llt.factor());
        for (int k = toIdentity.size() - 1; k >= 0; k--) {
            ColumnOperation op = toIdentity.get(k);
            context.emit(OpType.CX, op.control(), op.target());
        }
    }
}
