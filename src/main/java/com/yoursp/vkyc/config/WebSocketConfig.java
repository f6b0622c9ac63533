package com.yoursp.vkyc.config;

import com.yoursp.vkyc.modules.signaling.SignalingWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the signaling endpoint {@code /ws/vkyc/{sessionId}}.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final SignalingWebSocketHandler signalingHandler;
    private final VkycProperties properties;

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(signalingHandler, "/ws/vkyc/*")
                .setAllowedOrigins("http://localhost:4200", properties.getFrontendBaseUrl());
    }

    /**
     * Capture submissions carry whole document images.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getSignaling().getMaxMessageBytes());
        container.setMaxSessionIdleTimeout(properties.getSignaling().getHeartbeatTimeout().multipliedBy(2).toMillis());
        return container;
    }
}
