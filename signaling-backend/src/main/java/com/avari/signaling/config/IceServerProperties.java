package com.avari.signaling.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * STUN servers plus TURN credentials handed to browsers by {@code /api/ice-servers}.
 * Metered credentials take precedence over a custom TURN server.
 */
@ConfigurationProperties(prefix = "app.ice")
public record IceServerProperties(
        @DefaultValue({"stun:stun.l.google.com:19302", "stun:stun1.l.google.com:19302", "stun:stun2.l.google.com:19302"})
        List<String> stunUrls,
        @DefaultValue("a.relay.metered.ca") String meteredHost,
        String meteredUsername,
        String meteredCredential,
        String turnUrl,
        String turnUsername,
        String turnCredential
) {

    public boolean hasMeteredCredentials() {
        return StringUtils.hasText(meteredUsername) && StringUtils.hasText(meteredCredential);
    }

    public boolean hasCustomTurn() {
        return StringUtils.hasText(turnUrl);
    }
}
