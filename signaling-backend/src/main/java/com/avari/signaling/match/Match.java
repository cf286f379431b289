package com.avari.signaling.match;

import com.avari.signaling.signaling.ClientConnection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A 1:1 call session: up to two connections sharing a caller-supplied key.
 * Not thread-safe; only touched under {@link MatchRegistry}'s lock.
 */
class Match {
    static final int MAX_PARTICIPANTS = 2;

    private final String matchId;
    // join order
    private final Set<ClientConnection> members = new LinkedHashSet<>();
    private final Instant createdAt;
    private Instant lastActivityAt;

    Match(String matchId, Instant createdAt) {
        this.matchId = matchId;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    String matchId() {
        return matchId;
    }

    Instant createdAt() {
        return createdAt;
    }

    Instant lastActivityAt() {
        return lastActivityAt;
    }

    void touch(Instant now) {
        this.lastActivityAt = now;
    }

    boolean contains(ClientConnection connection) {
        return members.contains(connection);
    }

    boolean isFull() {
        return members.size() >= MAX_PARTICIPANTS;
    }

    boolean isEmpty() {
        return members.isEmpty();
    }

    int size() {
        return members.size();
    }

    void add(ClientConnection connection) {
        members.add(connection);
    }

    boolean remove(ClientConnection connection) {
        return members.remove(connection);
    }

    boolean hasLiveMember() {
        return members.stream().anyMatch(ClientConnection::isOpen);
    }

    List<ClientConnection> members() {
        return new ArrayList<>(members);
    }

    List<ClientConnection> membersExcept(ClientConnection connection) {
        List<ClientConnection> others = new ArrayList<>(members.size());
        for (ClientConnection member : members) {
            if (member != connection) {
                others.add(member);
            }
        }
        return others;
    }

    List<String> participantIds() {
        return members.stream().map(ClientConnection::userId).toList();
    }

    MatchSnapshot snapshot() {
        List<MatchSnapshot.Participant> participants = members.stream()
                .map(m -> new MatchSnapshot.Participant(m.userId(), m.isOpen()))
                .toList();
        return new MatchSnapshot(matchId, participants, createdAt, lastActivityAt);
    }
}
