package com.avari.signaling.signaling;

import com.avari.signaling.error.UserOfflineException;
import com.avari.signaling.error.ValidationException;
import com.avari.signaling.match.MatchRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Forwards offer / answer / ICE candidate payloads between two users.
 * Payloads are opaque: they are re-emitted unchanged, tagged with the sender.
 */
@Service
public class SignalingRouter {
    private static final Logger log = LoggerFactory.getLogger(SignalingRouter.class);

    private final MatchRegistry registry;

    public SignalingRouter(MatchRegistry registry) {
        this.registry = registry;
    }

    public void route(ClientConnection sender, SignalKind kind, String to, JsonNode payload) {
        String from = sender.requireUserId();
        registry.touch(sender.matchId());

        if (!StringUtils.hasText(to)) {
            if (kind.reportsOffline()) {
                throw new ValidationException("Missing target for " + kind.event());
            }
            log.debug("Dropping {} from {} without target", kind.event(), from);
            return;
        }

        Optional<ClientConnection> target = registry.lookup(to).filter(ClientConnection::isOpen);
        if (target.isEmpty()) {
            if (kind.reportsOffline()) {
                log.warn("Target user {} not connected for {} from {}", to, kind.event(), from);
                throw new UserOfflineException(to);
            }
            log.debug("Dropping {} from {}: {} is not connected", kind.event(), from, to);
            return;
        }

        Map<String, Object> forwarded = new LinkedHashMap<>();
        forwarded.put(kind.payloadField(), payload);
        forwarded.put("from", from);
        target.get().send(kind.event(), forwarded);

        if (kind == SignalKind.ICE_CANDIDATE) {
            log.trace("Forwarded ICE candidate from {} to {}", from, to);
        } else {
            log.info("Forwarded {} from {} to {}", kind.event(), from, to);
        }
    }
}
