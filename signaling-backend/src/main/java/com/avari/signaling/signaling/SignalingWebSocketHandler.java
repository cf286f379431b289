package com.avari.signaling.signaling;

import com.avari.signaling.error.ErrorType;
import com.avari.signaling.error.RelayException;
import com.avari.signaling.error.ValidationException;
import com.avari.signaling.match.MatchRegistry;
import com.avari.signaling.transcription.TranscriptionBridge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Signaling endpoint: one persistent WebSocket per client.
 *
 * Text frames are JSON envelopes dispatched to the registry, call control,
 * signaling router or transcription bridge. Binary frames are microphone audio
 * relayed to the connection's transcription stream. Every failure is turned
 * into exactly one error event for the sender; nothing propagates to the
 * container or to other connections.
 *
 * The container delivers frames of one session sequentially, so each
 * connection's events are handled in arrival order.
 */
@Component
public class SignalingWebSocketHandler extends AbstractWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(SignalingWebSocketHandler.class);

    static final String SHUTDOWN_MESSAGE = "Server is shutting down";

    // session id -> connection, registered or not
    private final ConcurrentHashMap<String, ClientConnection> connections = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final MatchRegistry registry;
    private final CallControlService callControl;
    private final SignalingRouter router;
    private final TranscriptionBridge transcription;

    public SignalingWebSocketHandler(ObjectMapper objectMapper,
            MatchRegistry registry,
            CallControlService callControl,
            SignalingRouter router,
            TranscriptionBridge transcription) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.callControl = callControl;
        this.router = router;
        this.transcription = transcription;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientConnection connection = new ClientConnection(session, objectMapper);
        connections.put(session.getId(), connection);
        log.info("New connection: {} (total: {})", session.getId(), connections.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection connection = connections.get(session.getId());
        if (connection == null) {
            log.warn("Received message from unknown session: {}", session.getId());
            return;
        }

        SignalingEnvelope envelope;
        try {
            envelope = objectMapper.readValue(message.getPayload(), SignalingEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed message from {}: {}", session.getId(), e.getOriginalMessage());
            sendError(connection, ErrorType.VALIDATION, "Malformed message");
            return;
        }
        if (!StringUtils.hasText(envelope.event())) {
            sendError(connection, ErrorType.VALIDATION, "Missing event name");
            return;
        }

        String event = envelope.event();
        try {
            dispatch(connection, envelope);
        } catch (RelayException e) {
            log.warn("Rejected {} from {}: {}", event, describe(connection), e.getMessage());
            reply(connection, event, e.getType(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error in {} from {}: {}", event, describe(connection), e.getMessage(), e);
            reply(connection, event, ErrorType.INTERNAL, "Failed to process " + event);
        }
    }

    /**
     * Binary frames are {@code audio-chunk} payloads.
     */
    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ClientConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        if (payload.remaining() == 0) {
            return;
        }
        byte[] audio = new byte[payload.remaining()];
        payload.get(audio);

        try {
            transcription.feed(connection, audio);
        } catch (RelayException e) {
            reply(connection, SignalingEvents.AUDIO_CHUNK, e.getType(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error relaying audio from {}: {}", describe(connection), e.getMessage(), e);
            reply(connection, SignalingEvents.AUDIO_CHUNK, ErrorType.INTERNAL, "Failed to relay audio");
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ClientConnection connection = connections.get(session.getId());
        log.error("Socket error from {}: {}", connection != null ? describe(connection) : session.getId(),
                exception.getMessage());
        if (connection != null) {
            connection.close(CloseStatus.SERVER_ERROR);
        }
    }

    /**
     * Tears down a closed connection: its transcription stream first, so no
     * provider socket outlives the client, then its registry membership.
     */
    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection connection = connections.remove(session.getId());
        if (connection == null) {
            return;
        }
        log.info("Client disconnected: {}, status: {}", describe(connection), status);
        try {
            transcription.release(connection);
        } finally {
            registry.remove(connection);
        }
    }

    /**
     * Tells every open connection the server is going away, releases their
     * transcription streams and closes them.
     *
     * @return number of connections notified
     */
    public int broadcastShutdown() {
        List<ClientConnection> snapshot = new ArrayList<>(connections.values());
        int notified = 0;
        for (ClientConnection connection : snapshot) {
            if (connection.send(SignalingEvents.SERVER_SHUTDOWN, Map.of("message", SHUTDOWN_MESSAGE))) {
                notified++;
            }
            transcription.release(connection);
            connection.close(CloseStatus.GOING_AWAY);
        }
        log.info("Shutdown notice sent to {} of {} connections", notified, snapshot.size());
        return notified;
    }

    public int connectionCount() {
        return connections.size();
    }

    private void dispatch(ClientConnection connection, SignalingEnvelope envelope) {
        switch (envelope.event()) {
            case SignalingEvents.REGISTER:
                registry.register(connection, envelope.text("userId"), envelope.text("matchId"));
                break;
            case SignalingEvents.INITIATE_CALL:
                callControl.initiate(connection, envelope.text("to"));
                break;
            case SignalingEvents.ACCEPT_CALL:
                callControl.accept(connection, envelope.text("to"));
                break;
            case SignalingEvents.REJECT_CALL:
                callControl.reject(connection, envelope.text("to"), envelope.text("reason"));
                break;
            case SignalingEvents.END_CALL:
                callControl.end(connection, envelope.text("to"));
                break;
            case SignalingEvents.OFFER:
                routeSignal(connection, SignalKind.OFFER, envelope);
                break;
            case SignalingEvents.ANSWER:
                routeSignal(connection, SignalKind.ANSWER, envelope);
                break;
            case SignalingEvents.ICE_CANDIDATE:
                routeSignal(connection, SignalKind.ICE_CANDIDATE, envelope);
                break;
            case SignalingEvents.TRANSCRIPTION_START:
                transcription.start(connection, envelope.text("language"));
                break;
            case SignalingEvents.TRANSCRIPTION_STOP:
                transcription.stop(connection);
                break;
            default:
                throw new ValidationException("Unknown event: " + envelope.event());
        }
    }

    private void routeSignal(ClientConnection connection, SignalKind kind, SignalingEnvelope envelope) {
        router.route(connection, kind, envelope.text("to"), envelope.node(kind.payloadField()));
    }

    /**
     * Transcription failures are reported on the transcription channel, all
     * others as a typed {@code error}.
     */
    private void reply(ClientConnection connection, String event, ErrorType type, String message) {
        if (event.startsWith(SignalingEvents.TRANSCRIPTION_PREFIX) || SignalingEvents.AUDIO_CHUNK.equals(event)) {
            connection.send(SignalingEvents.TRANSCRIPTION_ERROR, Map.of("message", message));
        } else {
            sendError(connection, type, message);
        }
    }

    private void sendError(ClientConnection connection, ErrorType type, String message) {
        connection.send(SignalingEvents.ERROR, Map.of("type", type.tag(), "message", message));
    }

    private static String describe(ClientConnection connection) {
        return connection.isRegistered() ? connection.userId() + "@" + connection.id() : connection.id();
    }
}
