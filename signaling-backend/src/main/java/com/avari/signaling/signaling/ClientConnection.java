package com.avari.signaling.signaling;

import com.avari.signaling.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * One client's persistent channel to the relay.
 *
 * Holds the identity labels assigned at registration and serializes outgoing
 * events. Sends go through a {@link ConcurrentWebSocketSessionDecorator}
 * because transcription callbacks write from provider threads while the
 * container thread handles inbound frames.
 */
public class ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    // written only under MatchRegistry's lock
    private volatile String userId;
    private volatile String matchId;

    public ClientConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        this.objectMapper = objectMapper;
    }

    public String id() {
        return session.getId();
    }

    public String userId() {
        return userId;
    }

    public String matchId() {
        return matchId;
    }

    public boolean isRegistered() {
        return userId != null;
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    /**
     * Returns the registered userId, failing when the connection has not sent
     * {@code register} yet.
     */
    public String requireUserId() {
        String current = userId;
        if (current == null) {
            throw new ValidationException("Connection is not registered");
        }
        return current;
    }

    public void bind(String userId, String matchId) {
        this.userId = userId;
        this.matchId = matchId;
    }

    /**
     * Sends one event. Delivery is best effort: failures are logged and
     * reported through the return value, never thrown.
     */
    public boolean send(String event, Object data) {
        if (!session.isOpen()) {
            log.debug("Dropping {} for closed connection {}", event, id());
            return false;
        }
        try {
            String json = objectMapper.writeValueAsString(new OutboundMessage(event, data));
            session.sendMessage(new TextMessage(json));
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for connection {}: {}", event, id(), e.getMessage());
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("Failed to send {} to connection {}: {}", event, id(), e.getMessage());
        }
        return false;
    }

    public void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("Error closing connection {}: {}", id(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "ClientConnection[" + id() + ", user=" + userId + ", match=" + matchId + "]";
    }

    /**
     * Outgoing frame format, mirror of {@link SignalingEnvelope}.
     */
    public record OutboundMessage(String event, Object data) {
    }
}
