package com.avari.signaling.signaling;

import com.avari.signaling.error.UserOfflineException;
import com.avari.signaling.error.ValidationException;
import com.avari.signaling.match.MatchRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes call-control messages between the two users of a match.
 *
 * The server keeps no call state: clients drive their own
 * idle / calling / ringing / connected / ended machines from the forwarded
 * events. Only {@link #initiate} reports an offline target; the other
 * operations are fire-and-forget.
 */
@Service
public class CallControlService {
    private static final Logger log = LoggerFactory.getLogger(CallControlService.class);

    static final String DEFAULT_REJECT_REASON = "User declined";

    private final MatchRegistry registry;

    public CallControlService(MatchRegistry registry) {
        this.registry = registry;
    }

    /**
     * Rings the target with {@code incoming-call}.
     *
     * @throws ValidationException  if the sender is unregistered or no target is named
     * @throws UserOfflineException if the target has no live connection
     */
    public void initiate(ClientConnection caller, String to) {
        String from = caller.requireUserId();
        if (!StringUtils.hasText(to)) {
            throw new ValidationException("Missing call target");
        }
        log.info("Call initiated: {} -> {}", from, to);

        ClientConnection target = liveConnection(to)
                .orElseThrow(() -> new UserOfflineException(to));
        target.send(SignalingEvents.INCOMING_CALL, Map.of("from", from));
        registry.touch(caller.matchId());
    }

    public void accept(ClientConnection callee, String to) {
        String from = callee.requireUserId();
        log.info("Call accepted: {} -> {}", from, to);
        registry.touch(callee.matchId());
        liveConnection(to).ifPresent(target ->
                target.send(SignalingEvents.CALL_ACCEPTED, Map.of("from", from)));
    }

    public void reject(ClientConnection callee, String to, String reason) {
        String from = callee.requireUserId();
        log.info("Call rejected: {} -> {}", from, to);
        registry.touch(callee.matchId());
        String effectiveReason = StringUtils.hasText(reason) ? reason : DEFAULT_REJECT_REASON;
        liveConnection(to).ifPresent(target ->
                target.send(SignalingEvents.CALL_REJECTED, Map.of("from", from, "reason", effectiveReason)));
    }

    /**
     * Sends {@code call-ended} to the named target, if any, and to every other
     * member of the sender's match. Each connection is notified once.
     */
    public void end(ClientConnection sender, String to) {
        String from = sender.requireUserId();
        log.info("Call ended by: {}", from);
        registry.touch(sender.matchId());

        Map<String, Object> payload = Map.of("from", from);
        Set<ClientConnection> notified = Collections.newSetFromMap(new IdentityHashMap<>());

        if (StringUtils.hasText(to)) {
            liveConnection(to)
                    .filter(target -> target != sender)
                    .ifPresent(target -> {
                        target.send(SignalingEvents.CALL_ENDED, payload);
                        notified.add(target);
                    });
        }

        for (ClientConnection peer : registry.peersOf(sender)) {
            if (notified.add(peer)) {
                peer.send(SignalingEvents.CALL_ENDED, payload);
            }
        }
    }

    private Optional<ClientConnection> liveConnection(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return registry.lookup(userId).filter(ClientConnection::isOpen);
    }
}
