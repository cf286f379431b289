package com.avari.signaling.lifecycle;

import com.avari.signaling.config.CorsProperties;
import com.avari.signaling.config.TranscriptionProperties;
import com.avari.signaling.webrtc.IceServerCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs which optional services are enabled once the server is up.
 */
@Component
public class StartupSummary {
    private static final Logger log = LoggerFactory.getLogger(StartupSummary.class);

    private final TranscriptionProperties transcriptionProperties;
    private final IceServerCatalog iceServerCatalog;
    private final CorsProperties corsProperties;

    public StartupSummary(TranscriptionProperties transcriptionProperties,
            IceServerCatalog iceServerCatalog,
            CorsProperties corsProperties) {
        this.transcriptionProperties = transcriptionProperties;
        this.iceServerCatalog = iceServerCatalog;
        this.corsProperties = corsProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void report() {
        log.info("Signaling relay ready: allowedOrigins={}", corsProperties.allowedOrigins());
        log.info("  TURN relay: {}", iceServerCatalog.hasTurn() ? "configured" : "not configured (STUN only)");
        log.info("  Transcription: {}", transcriptionProperties.isConfigured()
                ? "enabled (" + transcriptionProperties.model() + ")"
                : "disabled (no API key)");
    }
}
