package com.avari.signaling.web;

import com.avari.signaling.match.MatchRegistry;
import com.avari.signaling.signaling.SignalingWebSocketHandler;
import com.avari.signaling.web.dto.HealthResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Liveness probe and service descriptor.
 */
@RestController
public class HealthController {

    private final MatchRegistry registry;
    private final SignalingWebSocketHandler signalingHandler;
    private final Clock clock;
    private final String appName;
    private final String version;

    public HealthController(MatchRegistry registry,
            SignalingWebSocketHandler signalingHandler,
            Clock clock,
            @Value("${app.name:Avari}") String appName,
            @Value("${app.version:1.0.0}") String version) {
        this.registry = registry;
        this.signalingHandler = signalingHandler;
        this.clock = clock;
        this.appName = appName;
        this.version = version;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse(
                "ok",
                appName,
                version,
                Instant.now(clock),
                new HealthResponse.Stats(
                        registry.matchCount(),
                        registry.connectedUserCount(),
                        signalingHandler.connectionCount())));
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "app", appName + " Backend",
                "version", version,
                "description", "WebRTC signaling server for " + appName + " video calling",
                "endpoints", Map.of(
                        "health", "/health",
                        "stats", "/api/stats",
                        "iceServers", "/api/ice-servers",
                        "signaling", "/ws/signaling")));
    }
}
