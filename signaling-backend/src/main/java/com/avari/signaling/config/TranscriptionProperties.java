package com.avari.signaling.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Streaming transcription provider settings. Without an API key the bridge
 * stays disabled and {@code transcription:start} is answered with an error.
 */
@Validated
@ConfigurationProperties(prefix = "app.transcription")
public record TranscriptionProperties(
        String apiKey,
        @NotBlank @DefaultValue("wss://api.deepgram.com/v1/listen") String endpoint,
        @NotBlank @DefaultValue("nova-2") String model,
        @NotBlank @DefaultValue("en-US") String defaultLanguage,
        @NotBlank @DefaultValue("linear16") String encoding,
        @Positive @DefaultValue("16000") int sampleRate,
        @Positive @DefaultValue("1") int channels
) {

    public boolean isConfigured() {
        return StringUtils.hasText(apiKey);
    }

    /**
     * Builds the provider's listen URL for one stream.
     */
    public URI listenUri(String language) {
        return UriComponentsBuilder.fromUriString(endpoint)
                .queryParam("model", model)
                .queryParam("language", language)
                .queryParam("punctuate", true)
                .queryParam("interim_results", true)
                .queryParam("smart_format", true)
                .queryParam("encoding", encoding)
                .queryParam("sample_rate", sampleRate)
                .queryParam("channels", channels)
                .encode()
                .build()
                .toUri();
    }
}
