package io.github.drompincen.collabsync.runtime.connection;

import java.time.Duration;

public record ConnectionOptions(
        Duration heartbeatInterval,
        int maxReconnectAttempts,
        boolean autoReconnect,
        BackoffPolicy backoff
) {

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;

    public ConnectionOptions {
        if (heartbeatInterval == null) heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0: " + maxReconnectAttempts);
        }
        if (backoff == null) backoff = BackoffPolicy.defaults();
    }

    public static ConnectionOptions defaults() {
        return new ConnectionOptions(DEFAULT_HEARTBEAT_INTERVAL, DEFAULT_MAX_RECONNECT_ATTEMPTS,
                true, BackoffPolicy.defaults());
    }
}
