package com.phillippitts.speechrelay.config;

import com.phillippitts.speechrelay.config.properties.RelayProperties;
import com.phillippitts.speechrelay.presentation.websocket.SpeechRelayWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the relay endpoint and sizes the WebSocket container for audio frames.
 *
 * <p>Only the configured client origin may complete the handshake.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SpeechRelayWebSocketHandler handler;
    private final RelayProperties relay;

    public WebSocketConfig(SpeechRelayWebSocketHandler handler, RelayProperties relay) {
        this.handler = handler;
        this.relay = relay;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, relay.getEndpoint())
                .setAllowedOrigins(relay.getAllowedOrigin());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        RelayProperties.WebSocketProperties websocket = relay.getWebsocket();
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(websocket.getMaxBinaryMessageBytes());
        container.setMaxTextMessageBufferSize(websocket.getMaxTextMessageBytes());
        container.setAsyncSendTimeout(websocket.getSendTimeLimit().toMillis());
        return container;
    }
}
