package com.avari.signaling.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Match housekeeping and channel limits.
 *
 * @param reaperInterval        how often abandoned matches are scanned for
 * @param staleMatchTimeout     idle time after which a match without live members is purged
 * @param maxTextMessageBytes   largest accepted signaling frame
 * @param maxBinaryMessageBytes largest accepted audio frame
 */
@Validated
@ConfigurationProperties(prefix = "app.relay")
public record RelayProperties(
        @NotNull @DefaultValue("PT5M") Duration reaperInterval,
        @NotNull @DefaultValue("PT30M") Duration staleMatchTimeout,
        @Positive @DefaultValue("65536") int maxTextMessageBytes,
        @Positive @DefaultValue("262144") int maxBinaryMessageBytes
) {
}
