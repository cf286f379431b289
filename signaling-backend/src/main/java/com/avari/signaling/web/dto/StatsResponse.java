package com.avari.signaling.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Occupancy diagnostics returned by {@code /api/stats}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {

    private int activeMatches;
    private int connectedUsers;
    private int totalSockets;
    private int transcriptionStreams;
    private List<MatchSummaryDto> matches;
    private Instant timestamp;
}
