package com.avari.signaling.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Extracts the best alternative from a provider message of the form
 * {@code {"channel":{"alternatives":[{"transcript":"..."}]},"is_final":true}}.
 * Metadata frames and empty interim transcripts yield nothing.
 */
@Component
public class TranscriptResultParser {
    private static final Logger log = LoggerFactory.getLogger(TranscriptResultParser.class);

    private final ObjectMapper objectMapper;

    public TranscriptResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<TranscriptionResult> parse(String payload, long timestamp) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse transcription message: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        String transcript = root.path("channel").path("alternatives").path(0).path("transcript").asText("");
        if (transcript.isEmpty()) {
            return Optional.empty();
        }

        JsonNode isFinal = root.path("is_final");
        return Optional.of(new TranscriptionResult(
                transcript,
                isFinal.isBoolean() && isFinal.booleanValue(),
                timestamp));
    }
}
