package com.avari.signaling.error;

/**
 * Base exception for every failure the relay reports back to a client.
 * Thrown from registry, routing and transcription operations and converted
 * into a single error event at the WebSocket handler boundary.
 */
public class RelayException extends RuntimeException {

    private final ErrorType type;

    public RelayException(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public RelayException(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ErrorType getType() {
        return type;
    }
}
