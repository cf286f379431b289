package com.avari.signaling.error;

/**
 * Thrown when a routed message names a user with no live connection.
 */
public class UserOfflineException extends RelayException {

    private final String userId;

    public UserOfflineException(String userId) {
        super(ErrorType.USER_OFFLINE, "Target user " + userId + " is not connected");
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
