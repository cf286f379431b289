package com.avari.signaling.config;

import com.avari.signaling.signaling.SignalingWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the signaling endpoint.
 *
 * Clients connect with ws://host:port/ws/signaling and exchange JSON text
 * frames ({"event": ..., "data": ...}); binary frames carry microphone audio
 * for transcription.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SignalingWebSocketHandler signalingWebSocketHandler;
    private final CorsProperties corsProperties;
    private final RelayProperties relayProperties;

    public WebSocketConfig(SignalingWebSocketHandler signalingWebSocketHandler,
            CorsProperties corsProperties,
            RelayProperties relayProperties) {
        this.signalingWebSocketHandler = signalingWebSocketHandler;
        this.corsProperties = corsProperties;
        this.relayProperties = relayProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(signalingWebSocketHandler, "/ws/signaling")
                .setAllowedOriginPatterns(corsProperties.originPatterns());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(relayProperties.maxTextMessageBytes());
        container.setMaxBinaryMessageBufferSize(relayProperties.maxBinaryMessageBytes());
        return container;
    }
}
