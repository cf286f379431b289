package com.avari.signaling.transcription;

import com.avari.signaling.signaling.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Owned handle on one provider stream: the pending handshake, then the open
 * provider session, tied to the client connection that started it.
 *
 * {@link #close()} is safe from any thread and on every exit path; a
 * handshake that completes after close is torn down on arrival.
 */
class TranscriptionSession {
    private static final Logger log = LoggerFactory.getLogger(TranscriptionSession.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 1024 * 1024;

    private final ClientConnection owner;
    private final String language;

    private volatile CompletableFuture<WebSocketSession> handshake;
    private volatile WebSocketSession provider;
    private volatile boolean closed;

    TranscriptionSession(ClientConnection owner, String language) {
        this.owner = owner;
        this.language = language;
    }

    ClientConnection owner() {
        return owner;
    }

    String language() {
        return language;
    }

    boolean isClosed() {
        return closed;
    }

    boolean isOpen() {
        WebSocketSession current = provider;
        return !closed && current != null && current.isOpen();
    }

    void pending(CompletableFuture<WebSocketSession> handshake) {
        this.handshake = handshake;
        if (closed) {
            handshake.cancel(true);
        }
    }

    /**
     * Binds the opened provider session.
     *
     * @return false if this handle was already closed, in which case the
     * provider session is closed immediately
     */
    synchronized boolean attach(WebSocketSession session) {
        if (closed) {
            closeQuietly(session);
            return false;
        }
        this.provider = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        return true;
    }

    void send(byte[] audio) throws IOException {
        WebSocketSession current = provider;
        if (current == null) {
            return;
        }
        current.sendMessage(new BinaryMessage(audio));
    }

    synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        CompletableFuture<WebSocketSession> pending = handshake;
        if (pending != null && !pending.isDone()) {
            pending.cancel(true);
        }
        WebSocketSession current = provider;
        if (current != null) {
            closeQuietly(current);
        }
    }

    private void closeQuietly(WebSocketSession session) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("Error closing transcription stream for connection {}: {}", owner.id(), e.getMessage());
        }
    }
}
