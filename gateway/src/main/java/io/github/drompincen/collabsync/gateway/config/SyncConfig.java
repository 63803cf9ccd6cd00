package io.github.drompincen.collabsync.gateway.config;

import io.github.drompincen.collabsync.gateway.transport.SpringWebSocketTransport;
import io.github.drompincen.collabsync.runtime.connection.TransportFactory;
import io.github.drompincen.collabsync.runtime.engine.SyncSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Duration;

@Configuration
public class SyncConfig {

    private static final Logger log = LoggerFactory.getLogger(SyncConfig.class);

    @Bean
    SyncSettings syncSettings(
            @Value("${collabsync.heartbeat-interval:30s}") Duration heartbeatInterval,
            @Value("${collabsync.max-reconnect-attempts:5}") int maxReconnectAttempts,
            @Value("${collabsync.auto-reconnect:true}") boolean autoReconnect,
            @Value("${collabsync.max-backoff:30s}") Duration maxBackoff,
            @Value("${collabsync.presence.debounce:100ms}") Duration presenceDebounce,
            @Value("${collabsync.presence.stale-after:30s}") Duration presenceStaleAfter,
            @Value("${collabsync.notification-ttl:5s}") Duration notificationTtl,
            @Value("${collabsync.share-base-url:http://localhost:${server.port:8080}}") String shareBaseUrl,
            @Value("${collabsync.profile-id:default}") String profileId) {
        SyncSettings settings = new SyncSettings(heartbeatInterval, maxReconnectAttempts, autoReconnect,
                maxBackoff, presenceDebounce, presenceStaleAfter, notificationTtl, shareBaseUrl, profileId);
        log.info("Sync settings: heartbeat {}, {} reconnect attempts, share links under {}",
                settings.heartbeatInterval(), settings.maxReconnectAttempts(), settings.shareBaseUrl());
        return settings;
    }

    @Bean
    TransportFactory transportFactory() {
        StandardWebSocketClient client = new StandardWebSocketClient();
        return () -> new SpringWebSocketTransport(client);
    }
}
