package org.cliffsynth.converter.synthesis.features;

import org.cliffsynth.api.ConversionErrorCode;
import org.cliffsynth.api.InvalidTableauException;
import org.cliffsynth.circuit.OpType;
import org.cliffsynth.converter.synthesis.ISynthesisStep;
import org.cliffsynth.converter.synthesis.SynthesisContext;
import org.cliffsynth.converter.synthesis.SynthesisLayer;
import org.cliffsynth.converter.synthesis.TableauBlock;
import org.cliffsynth.linalg.BitMatrix;
import org.cliffsynth.linalg.ColumnOperation;
import org.cliffsynth.linalg.GaussianElimination;

/**
 * Reduces an X block of the residual to the identity with a layer of CX gates, one per
 * column operation of the Gaussian elimination.
 */
public class GaussianEliminationStep implements ISynthesisStep {

    private final SynthesisLayer layer;
    private final TableauBlock block;

    /**
     * @param layer The layer the CX gates are counted towards.
     * @param block The block to reduce; {@link TableauBlock#STABILIZER_X} or {@link TableauBlock#DESTABILIZER_X}.
     */
    public GaussianEliminationStep(SynthesisLayer layer, TableauBlock block) {
        this.layer = layer;
        this.block = block;
    }

    @Override
    public void apply(SynthesisContext context) throws InvalidTableauException {
        context.beginLayer(layer);
        BitMatrix matrix = block.read(context.residual());
        if (!matrix.isInvertible()) {
            throw new InvalidTableauException(ConversionErrorCode.NOT_SYMPLECTIC,
                    "Block " + block + " is singular before " + layer + ": " + matrix);
        }
        for (ColumnOperation op : GaussianElimination.columnOperations(matrix)) {
            context.emit(OpType.CX, op.control(), op.target());
        }
    }
}
