package com.avari.signaling.error;

/**
 * Thrown when an operation needs a setting the server was started without.
 */
public class ConfigurationException extends RelayException {

    public ConfigurationException(String message) {
        super(ErrorType.CONFIGURATION, message);
    }
}
