package org.cliffsynth.api;

/**
 * Defines unique, testable error codes for all errors a conversion can raise.
 * This decouples the test logic from the exception messages.
 */
public enum ConversionErrorCode {
    // region Circuit to tableau
    /** A command uses a gate type outside {H, V, S, CX, X, Z}. */
    UNSUPPORTED_OPERATION,
    // endregion

    // region Tableau to circuit
    /** The stabilizer rows of the tableau are not mutually independent. */
    STABILIZERS_NOT_INDEPENDENT,
    /** The rows are independent but violate the commutation relations of a symplectic basis. */
    NOT_SYMPLECTIC
    // endregion
}
