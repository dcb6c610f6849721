package org.cliffsynth.api;

/**
 * Thrown when a circuit or tableau cannot be converted.
 * <p>
 * It is part of the public API; every instance carries a {@link ConversionErrorCode}.
 */
public class ConversionException extends Exception {

    private final ConversionErrorCode errorCode;

    /**
     * Constructs a new conversion exception.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public ConversionException(ConversionErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * @return The error code describing what went wrong.
     */
    public ConversionErrorCode getErrorCode() {
        return errorCode;
    }
}
