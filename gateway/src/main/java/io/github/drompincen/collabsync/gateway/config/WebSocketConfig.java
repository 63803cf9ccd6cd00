package io.github.drompincen.collabsync.gateway.config;

import io.github.drompincen.collabsync.gateway.websocket.RelayWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.time.Duration;
import java.util.Arrays;

/**
 * Mounts the relay endpoint. Sync responses carry up to a full event log, so the container's text
 * buffer is raised well above its 8 KB default.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final RelayWebSocketHandler relayHandler;
    private final String relayPath;
    private final String[] allowedOrigins;

    public WebSocketConfig(RelayWebSocketHandler relayHandler,
                           @Value("${collabsync.relay.path:/ws}") String relayPath,
                           @Value("${collabsync.relay.allowed-origins:*}") String[] allowedOrigins) {
        this.relayHandler = relayHandler;
        this.relayPath = relayPath;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        log.info("Relay listening on {} (origins {})", relayPath, Arrays.toString(allowedOrigins));
        registry.addHandler(relayHandler, relayPath).setAllowedOrigins(allowedOrigins);
    }

    @Bean
    public ServletServerContainerFactoryBean relayContainer(
            @Value("${collabsync.relay.max-text-message-size:1MB}") DataSize maxTextMessageSize,
            @Value("${collabsync.relay.idle-timeout:5m}") Duration idleTimeout) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize((int) maxTextMessageSize.toBytes());
        container.setMaxSessionIdleTimeout(idleTimeout.toMillis());
        return container;
    }
}
