package com.avari.signaling.lifecycle;

import com.avari.signaling.signaling.SignalingWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Notifies connected clients before the web server stops.
 *
 * Runs in the default (last-started, first-stopped) phase, ahead of the
 * embedded server's graceful shutdown, so the {@code server-shutdown} event
 * still reaches open sockets.
 */
@Component
public class RelayShutdownLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(RelayShutdownLifecycle.class);

    private final SignalingWebSocketHandler signalingHandler;
    private volatile boolean running;

    public RelayShutdownLifecycle(SignalingWebSocketHandler signalingHandler) {
        this.signalingHandler = signalingHandler;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Shutting down gracefully...");
        signalingHandler.broadcastShutdown();
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
