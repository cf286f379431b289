package com.avari.signaling.config;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Browser origins trusted by the relay. One list covers both the HTTP
 * endpoints and the signaling WebSocket handshake, since the same frontend
 * uses both.
 *
 * @param allowedOrigins origin patterns, wildcards as accepted by
 *                       {@link org.springframework.web.cors.CorsConfiguration#setAllowedOriginPatterns(List)}
 */
@Validated
@ConfigurationProperties(prefix = "app.cors")
public record CorsProperties(
        @NotEmpty @DefaultValue("http://localhost:3000") List<String> allowedOrigins
) {

    public String[] originPatterns() {
        return allowedOrigins.toArray(String[]::new);
    }
}
