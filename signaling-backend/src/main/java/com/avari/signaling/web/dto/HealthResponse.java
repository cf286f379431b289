package com.avari.signaling.web.dto;

import java.time.Instant;

/**
 * Liveness probe payload.
 */
public record HealthResponse(
        String status,
        String app,
        String version,
        Instant timestamp,
        Stats stats) {

    public record Stats(int activeMatches, int connectedUsers, int totalConnections) {
    }
}
