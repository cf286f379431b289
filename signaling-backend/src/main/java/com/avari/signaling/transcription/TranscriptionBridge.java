package com.avari.signaling.transcription;

import com.avari.signaling.config.TranscriptionProperties;
import com.avari.signaling.error.ConfigurationException;
import com.avari.signaling.error.ProviderException;
import com.avari.signaling.signaling.ClientConnection;
import com.avari.signaling.signaling.SignalingEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-connection proxy to the streaming transcription provider.
 *
 * Each client connection owns at most one provider stream, tracked in a table
 * keyed by connection id. Audio frames from the client are relayed verbatim;
 * provider results are normalized and pushed back as
 * {@code transcription:result}. Streams are released on explicit stop,
 * provider close, provider error and client disconnect.
 */
@Service
public class TranscriptionBridge {
    private static final Logger log = LoggerFactory.getLogger(TranscriptionBridge.class);

    private final WebSocketClient providerClient;
    private final TranscriptionProperties properties;
    private final TranscriptResultParser parser;
    private final Clock clock;

    // connection id -> provider stream
    private final ConcurrentHashMap<String, TranscriptionSession> sessions = new ConcurrentHashMap<>();

    public TranscriptionBridge(WebSocketClient providerClient,
            TranscriptionProperties properties,
            TranscriptResultParser parser,
            Clock clock) {
        this.providerClient = providerClient;
        this.properties = properties;
        this.parser = parser;
        this.clock = clock;
    }

    /**
     * Opens a provider stream for the connection, replacing any existing one.
     * {@code transcription:ready} follows once the provider accepts the stream.
     *
     * @throws ConfigurationException if no provider API key is configured
     * @throws ProviderException      if the handshake cannot be started
     */
    public void start(ClientConnection connection, String language) {
        if (!properties.isConfigured()) {
            throw new ConfigurationException("Transcription API key not configured on server");
        }

        stop(connection);

        String lang = StringUtils.hasText(language) ? language : properties.defaultLanguage();
        URI uri = properties.listenUri(lang);
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + properties.apiKey());

        TranscriptionSession session = new TranscriptionSession(connection, lang);
        sessions.put(connection.id(), session);
        log.info("Opening transcription stream for connection {}, language: {}", connection.id(), lang);

        CompletableFuture<WebSocketSession> handshake;
        try {
            handshake = providerClient.execute(new ProviderStreamHandler(session), headers, uri);
        } catch (RuntimeException e) {
            release(session);
            throw new ProviderException("Failed to start transcription", e);
        }
        session.pending(handshake);
        handshake.whenComplete((opened, error) -> {
            if (error != null) {
                onHandshakeFailure(session, error);
            }
        });
    }

    /**
     * Relays one audio frame. Frames arriving while no stream is open are
     * dropped; nothing is buffered.
     *
     * @throws ProviderException if the provider stream rejects the write; the
     *                           stream is closed before this is thrown
     */
    public void feed(ClientConnection connection, byte[] audio) {
        TranscriptionSession session = sessions.get(connection.id());
        if (session == null || !session.isOpen()) {
            log.trace("Dropping {} bytes of audio from connection {}: no open stream", audio.length, connection.id());
            return;
        }
        try {
            session.send(audio);
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("Failed to relay audio for connection {}: {}", connection.id(), e.getMessage());
            release(session);
            throw new ProviderException("Failed to send audio to transcription provider", e);
        }
    }

    /**
     * Closes the connection's stream if there is one. Idempotent.
     */
    public void stop(ClientConnection connection) {
        TranscriptionSession session = sessions.remove(connection.id());
        if (session != null) {
            log.info("Stopping transcription stream for connection {}", connection.id());
            session.close();
        }
    }

    /**
     * Disconnect path: cancels a pending handshake or closes the open stream.
     */
    public void release(ClientConnection connection) {
        TranscriptionSession session = sessions.remove(connection.id());
        if (session != null) {
            session.close();
            log.info("Cleaned up transcription stream for disconnected connection {}", connection.id());
        }
    }

    public boolean hasSession(ClientConnection connection) {
        return sessions.containsKey(connection.id());
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private void release(TranscriptionSession session) {
        sessions.remove(session.owner().id(), session);
        session.close();
    }

    private boolean isCurrent(TranscriptionSession session) {
        return sessions.get(session.owner().id()) == session;
    }

    private void onHandshakeFailure(TranscriptionSession session, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof CancellationException || session.isClosed()) {
            return;
        }
        log.error("Transcription handshake failed for connection {}: {}", session.owner().id(), cause.getMessage());
        release(session);
        session.owner().send(SignalingEvents.TRANSCRIPTION_ERROR, Map.of("message", messageOf(cause)));
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Provider-side callbacks for one stream.
     */
    private final class ProviderStreamHandler extends TextWebSocketHandler {
        private final TranscriptionSession session;

        private ProviderStreamHandler(TranscriptionSession session) {
            this.session = session;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession providerSession) {
            if (!isCurrent(session)) {
                session.close();
            }
            if (!session.attach(providerSession)) {
                log.debug("Discarding superseded transcription stream for connection {}", session.owner().id());
                return;
            }
            log.info("Transcription stream opened for connection {}", session.owner().id());
            session.owner().send(SignalingEvents.TRANSCRIPTION_READY, Map.of());
        }

        @Override
        protected void handleTextMessage(WebSocketSession providerSession, TextMessage message) {
            parser.parse(message.getPayload(), clock.millis())
                    .ifPresent(result -> session.owner().send(SignalingEvents.TRANSCRIPTION_RESULT, result));
        }

        @Override
        public void handleTransportError(WebSocketSession providerSession, Throwable exception) {
            log.error("Transcription stream error for connection {}: {}", session.owner().id(), exception.getMessage());
            session.owner().send(SignalingEvents.TRANSCRIPTION_ERROR, Map.of("message", messageOf(exception)));
            release(session);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession providerSession, CloseStatus status) {
            String reason = status.getReason() != null ? status.getReason() : "";
            log.info("Transcription stream closed for connection {}, code: {}, reason: {}",
                    session.owner().id(), status.getCode(), reason);
            release(session);
            session.owner().send(SignalingEvents.TRANSCRIPTION_CLOSED, Map.of(
                    "code", status.getCode(),
                    "reason", reason));
        }
    }
}
