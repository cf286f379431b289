package com.avari.signaling.error;

/**
 * Thrown when a message is missing a required identifier or cannot be read.
 */
public class ValidationException extends RelayException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorType.VALIDATION, message, cause);
    }
}
