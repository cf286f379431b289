package com.avari.signaling.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;

/**
 * Shared infrastructure beans for the relay: time source, outbound WebSocket
 * client for the transcription provider, and the scheduler for the match reaper.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({
        CorsProperties.class,
        RelayProperties.class,
        TranscriptionProperties.class,
        IceServerProperties.class})
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebSocketClient transcriptionWebSocketClient() {
        return new StandardWebSocketClient();
    }
}
