package org.cliffsynth.api;

/**
 * Raised when a tableau does not describe a valid stabilizer group and therefore has
 * no circuit realisation.
 */
public class InvalidTableauException extends ConversionException {

    /**
     * @param message The detail message.
     */
    public InvalidTableauException(String message) {
        this(ConversionErrorCode.STABILIZERS_NOT_INDEPENDENT, message);
    }

    /**
     * @param errorCode {@link ConversionErrorCode#STABILIZERS_NOT_INDEPENDENT} or
     *                  {@link ConversionErrorCode#NOT_SYMPLECTIC}.
     * @param message The detail message.
     */
    public InvalidTableauException(ConversionErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
