package com.avari.signaling.transcription;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized transcript sent to the client as {@code transcription:result}.
 *
 * @param timestamp epoch milliseconds at which the relay received the result
 */
public record TranscriptionResult(
        String text,
        @JsonProperty("isFinal") boolean isFinal,
        long timestamp) {
}
