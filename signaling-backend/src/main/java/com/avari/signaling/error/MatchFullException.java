package com.avari.signaling.error;

/**
 * Thrown when a connection tries to join a match that already holds the maximum
 * number of participants.
 */
public class MatchFullException extends RelayException {

    private final String matchId;

    public MatchFullException(String matchId, int capacity) {
        super(ErrorType.MATCH_FULL, "This match already has " + capacity + " participants");
        this.matchId = matchId;
    }

    public String getMatchId() {
        return matchId;
    }
}
