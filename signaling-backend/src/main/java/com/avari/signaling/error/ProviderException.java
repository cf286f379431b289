package com.avari.signaling.error;

/**
 * Thrown when the upstream transcription provider cannot be reached or written to.
 */
public class ProviderException extends RelayException {

    public ProviderException(String message, Throwable cause) {
        super(ErrorType.PROVIDER, message, cause);
    }
}
