package com.avari.signaling.match;

import com.avari.signaling.error.MatchFullException;
import com.avari.signaling.error.ValidationException;
import com.avari.signaling.signaling.ClientConnection;
import com.avari.signaling.signaling.SignalingEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the user index (userId -> connection) and the match table.
 *
 * Both tables sit behind one monitor so that adding or removing a member and
 * updating the index happen as a single step. Notifications are sent after the
 * monitor is released, to snapshots of the affected members, so a slow or
 * closing peer never blocks registry access.
 */
@Component
public class MatchRegistry {
    private static final Logger log = LoggerFactory.getLogger(MatchRegistry.class);

    private final Object lock = new Object();
    private final Map<String, ClientConnection> userIndex = new HashMap<>();
    private final Map<String, Match> matches = new LinkedHashMap<>();
    private final Clock clock;

    public MatchRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Admits a connection into a match under the given userId.
     *
     * A prior connection registered under the same userId is displaced from the
     * index silently and keeps its match membership.
     *
     * @return userIds of the match participants in join order
     * @throws ValidationException if either identifier is blank
     * @throws MatchFullException  if the match already holds two other connections
     */
    public List<String> register(ClientConnection connection, String userId, String matchId) {
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(matchId)) {
            throw new ValidationException("Missing userId or matchId");
        }

        List<String> participants;
        List<ClientConnection> peers;
        List<ClientConnection> formerPeers = List.of();
        String previousUserId;

        synchronized (lock) {
            Instant now = clock.instant();
            Match match = matches.get(matchId);
            if (match != null && match.isFull() && !match.contains(connection)) {
                throw new MatchFullException(matchId, Match.MAX_PARTICIPANTS);
            }

            previousUserId = connection.userId();
            String previousMatchId = connection.matchId();
            if (previousMatchId != null && !previousMatchId.equals(matchId)) {
                formerPeers = detach(connection, previousMatchId);
                log.info("Connection {} moved from match {} to {}", connection.id(), previousMatchId, matchId);
            }
            if (previousUserId != null && !previousUserId.equals(userId)) {
                userIndex.remove(previousUserId, connection);
            }

            if (match == null) {
                match = new Match(matchId, now);
                matches.put(matchId, match);
                log.debug("Created match {}", matchId);
            }

            match.add(connection);
            connection.bind(userId, matchId);
            ClientConnection displaced = userIndex.put(userId, connection);
            if (displaced != null && displaced != connection) {
                log.info("User {} re-registered; connection {} displaced by {}",
                        userId, displaced.id(), connection.id());
            }
            match.touch(now);

            participants = match.participantIds();
            peers = match.membersExcept(connection);
        }

        log.info("User {} joined match {} (participants: {})", userId, matchId, participants);

        for (ClientConnection formerPeer : formerPeers) {
            formerPeer.send(SignalingEvents.USER_LEFT, Map.of("userId", previousUserId));
        }

        Map<String, Object> joined = new LinkedHashMap<>();
        joined.put("matchId", matchId);
        joined.put("userId", userId);
        joined.put("participants", participants);
        joined.put("participantCount", participants.size());
        connection.send(SignalingEvents.JOINED, joined);

        for (ClientConnection peer : peers) {
            peer.send(SignalingEvents.USER_JOINED, Map.of(
                    "userId", userId,
                    "participantCount", participants.size()));
        }
        return participants;
    }

    /**
     * Resolves the connection currently indexed for a userId. The connection
     * may be closed; callers check liveness before routing.
     */
    public Optional<ClientConnection> lookup(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(userIndex.get(userId));
        }
    }

    /**
     * Refreshes a match's last-activity timestamp.
     */
    public void touch(String matchId) {
        if (matchId == null) {
            return;
        }
        synchronized (lock) {
            Match match = matches.get(matchId);
            if (match != null) {
                match.touch(clock.instant());
            }
        }
    }

    /**
     * Snapshot of the other members of the connection's current match.
     */
    public List<ClientConnection> peersOf(ClientConnection connection) {
        synchronized (lock) {
            String matchId = connection.matchId();
            Match match = matchId == null ? null : matches.get(matchId);
            if (match == null || !match.contains(connection)) {
                return List.of();
            }
            return match.membersExcept(connection);
        }
    }

    /**
     * Retracts a disconnected connection: drops the index entry for its userId,
     * leaves its match and tells the remaining members that the peer left and
     * the call ended. An emptied match is deleted.
     *
     * The index entry goes even when a later registration displaced this
     * connection; the newer connection stays in its match but is no longer
     * reachable by userId until it registers again.
     *
     * @return true if the connection was registered
     */
    public boolean remove(ClientConnection connection) {
        String userId = connection.userId();
        if (userId == null) {
            return false;
        }

        List<ClientConnection> remaining;
        synchronized (lock) {
            userIndex.remove(userId);
            remaining = detach(connection, connection.matchId());
        }

        log.info("User {} left match {} ({} remaining)", userId, connection.matchId(), remaining.size());

        for (ClientConnection peer : remaining) {
            peer.send(SignalingEvents.USER_LEFT, Map.of("userId", userId));
            peer.send(SignalingEvents.CALL_ENDED, Map.of("from", userId));
        }
        return true;
    }

    /**
     * Deletes matches that have no live member and have been idle longer than
     * the threshold. Members whose channel closed without a disconnect callback
     * are dropped from the user index as well.
     *
     * @return number of matches deleted
     */
    public int purgeStale(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        List<String> purged = new ArrayList<>();

        synchronized (lock) {
            Iterator<Match> it = matches.values().iterator();
            while (it.hasNext()) {
                Match match = it.next();
                if (match.hasLiveMember() || !match.lastActivityAt().isBefore(cutoff)) {
                    continue;
                }
                for (ClientConnection member : match.members()) {
                    if (member.userId() != null) {
                        userIndex.remove(member.userId(), member);
                    }
                }
                it.remove();
                purged.add(match.matchId());
            }
        }

        for (String matchId : purged) {
            log.info("Cleaned up stale match: {}", matchId);
        }
        return purged.size();
    }

    public int matchCount() {
        synchronized (lock) {
            return matches.size();
        }
    }

    public int connectedUserCount() {
        synchronized (lock) {
            return userIndex.size();
        }
    }

    public List<MatchSnapshot> snapshot() {
        synchronized (lock) {
            return matches.values().stream().map(Match::snapshot).toList();
        }
    }

    public Optional<MatchSnapshot> snapshot(String matchId) {
        synchronized (lock) {
            return Optional.ofNullable(matches.get(matchId)).map(Match::snapshot);
        }
    }

    // caller holds lock
    private List<ClientConnection> detach(ClientConnection connection, String matchId) {
        Match match = matchId == null ? null : matches.get(matchId);
        if (match == null || !match.remove(connection)) {
            return List.of();
        }
        if (match.isEmpty()) {
            matches.remove(matchId);
            log.info("Cleaned up empty match: {}", matchId);
            return List.of();
        }
        return match.members();
    }
}
