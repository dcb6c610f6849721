package org.cliffsynth.api;

import org.cliffsynth.circuit.OpType;

/**
 * Raised when a gate outside the Clifford generating set has to be applied to a tableau.
 */
public class UnsupportedOperationTypeException extends ConversionException {

    private final OpType opType;

    /**
     * @param opType The rejected gate type.
     */
    public UnsupportedOperationTypeException(OpType opType) {
        super(ConversionErrorCode.UNSUPPORTED_OPERATION,
                "Cannot apply " + opType + " to a Clifford tableau; supported gates are " + OpType.generatingSet());
        this.opType = opType;
    }

    public OpType getOpType() {
        return opType;
    }
}
