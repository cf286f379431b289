package com.avari.signaling.web;

import com.avari.signaling.match.MatchRegistry;
import com.avari.signaling.signaling.SignalingWebSocketHandler;
import com.avari.signaling.transcription.TranscriptionBridge;
import com.avari.signaling.web.dto.MatchSummaryDto;
import com.avari.signaling.web.dto.StatsResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Read-only diagnostics over the match registry.
 */
@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final MatchRegistry registry;
    private final SignalingWebSocketHandler signalingHandler;
    private final TranscriptionBridge transcriptionBridge;
    private final Clock clock;

    public StatsController(MatchRegistry registry,
            SignalingWebSocketHandler signalingHandler,
            TranscriptionBridge transcriptionBridge,
            Clock clock) {
        this.registry = registry;
        this.signalingHandler = signalingHandler;
        this.transcriptionBridge = transcriptionBridge;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<StatsResponse> stats() {
        List<MatchSummaryDto> matches = registry.snapshot().stream()
                .map(MatchSummaryDto::from)
                .toList();

        return ResponseEntity.ok(new StatsResponse(
                matches.size(),
                registry.connectedUserCount(),
                signalingHandler.connectionCount(),
                transcriptionBridge.activeSessionCount(),
                matches,
                Instant.now(clock)));
    }

    /**
     * Details of a single match, 404 if it does not exist.
     */
    @GetMapping("/matches/{matchId}")
    public ResponseEntity<MatchSummaryDto> match(@PathVariable String matchId) {
        return registry.snapshot(matchId)
                .map(MatchSummaryDto::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
