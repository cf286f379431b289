package com.avari.signaling.match;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a match taken under the registry lock, used by diagnostics.
 */
public record MatchSnapshot(
        String matchId,
        List<Participant> participants,
        Instant createdAt,
        Instant lastActivityAt) {

    public int participantCount() {
        return participants.size();
    }

    public record Participant(String userId, boolean connected) {
    }
}
