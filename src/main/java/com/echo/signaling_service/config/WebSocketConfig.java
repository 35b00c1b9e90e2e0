package com.echo.signaling_service.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.utility.SignalingWebSocketHandler;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    // SDP offers with many candidates exceed the 8KB container default
    private static final int MAX_TEXT_MESSAGE_BYTES = 256 * 1024;

    private final SignalingWebSocketHandler signalingWebSocketHandler;

    public WebSocketConfig(SignalingWebSocketHandler signalingWebSocketHandler) {
        this.signalingWebSocketHandler = signalingWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(signalingWebSocketHandler, ApplicationConstants.WEBSOCKET_PATH)
                .addInterceptors(new WebSocketLoggingInterceptor())
                .setAllowedOrigins("*");

        log.info("WebSocket handler registered - Path: {}", ApplicationConstants.WEBSOCKET_PATH);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        container.setMaxSessionIdleTimeout(10 * 60 * 1000L);
        return container;
    }
}
