package com.phillippitts.voicebridge.config.websocket;

import com.phillippitts.voicebridge.config.properties.AuthProperties;
import com.phillippitts.voicebridge.presentation.websocket.AudioStreamWebSocketHandler;
import com.phillippitts.voicebridge.presentation.websocket.AuthHandshakeInterceptor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the audio streaming endpoint and sizes the container's message buffers for audio
 * frames.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String TRANSCRIBE_PATH = "/ws/transcribe";

    private static final int MAX_BINARY_MESSAGE_BYTES = 1024 * 1024;
    private static final int MAX_TEXT_MESSAGE_BYTES = 64 * 1024;
    private static final long ASYNC_SEND_TIMEOUT_MS = 30_000L;

    private final AudioStreamWebSocketHandler handler;
    private final AuthHandshakeInterceptor handshakeInterceptor;
    private final AuthProperties authProperties;

    public WebSocketConfig(AudioStreamWebSocketHandler handler,
                           AuthHandshakeInterceptor handshakeInterceptor,
                           AuthProperties authProperties) {
        this.handler = handler;
        this.handshakeInterceptor = handshakeInterceptor;
        this.authProperties = authProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, TRANSCRIBE_PATH)
                .addInterceptors(handshakeInterceptor)
                .setAllowedOriginPatterns(authProperties.allowedOrigins());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(MAX_BINARY_MESSAGE_BYTES);
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        container.setAsyncSendTimeout(ASYNC_SEND_TIMEOUT_MS);
        return container;
    }
}
