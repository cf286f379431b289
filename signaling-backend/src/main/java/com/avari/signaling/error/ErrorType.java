package com.avari.signaling.error;

/**
 * Type tags carried by {@code error} events so clients can branch on the failure kind.
 */
public enum ErrorType {
    VALIDATION("validation"),
    MATCH_FULL("match_full"),
    USER_OFFLINE("user_offline"),
    CONFIGURATION("configuration"),
    PROVIDER("provider_error"),
    INTERNAL("server_error");

    private final String tag;

    ErrorType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
