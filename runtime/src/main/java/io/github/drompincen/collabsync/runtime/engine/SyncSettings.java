package io.github.drompincen.collabsync.runtime.engine;

import io.github.drompincen.collabsync.runtime.connection.BackoffPolicy;
import io.github.drompincen.collabsync.runtime.connection.ConnectionOptions;
import io.github.drompincen.collabsync.runtime.notify.NotificationCenter;
import io.github.drompincen.collabsync.runtime.presence.PresenceTracker;

import java.time.Duration;

/**
 * Tunables of one {@link SyncEngine}. {@code null} durations fall back to the defaults.
 */
public record SyncSettings(
        Duration heartbeatInterval,
        int maxReconnectAttempts,
        boolean autoReconnect,
        Duration maxBackoff,
        Duration presenceDebounce,
        Duration presenceStaleAfter,
        Duration notificationTtl,
        String shareBaseUrl,
        String profileId
) {

    public static final String DEFAULT_PROFILE_ID = "default";
    public static final String DEFAULT_SHARE_BASE_URL = "http://localhost:8080";

    public SyncSettings {
        if (heartbeatInterval == null) heartbeatInterval = ConnectionOptions.DEFAULT_HEARTBEAT_INTERVAL;
        if (maxBackoff == null) maxBackoff = BackoffPolicy.DEFAULT_MAX;
        if (presenceDebounce == null) presenceDebounce = PresenceTracker.DEFAULT_DEBOUNCE;
        if (presenceStaleAfter == null) presenceStaleAfter = PresenceTracker.DEFAULT_STALE_AFTER;
        if (notificationTtl == null) notificationTtl = NotificationCenter.DEFAULT_TTL;
        if (shareBaseUrl == null || shareBaseUrl.isBlank()) shareBaseUrl = DEFAULT_SHARE_BASE_URL;
        if (profileId == null || profileId.isBlank()) profileId = DEFAULT_PROFILE_ID;
    }

    public static SyncSettings defaults() {
        return new SyncSettings(null, ConnectionOptions.DEFAULT_MAX_RECONNECT_ATTEMPTS, true,
                null, null, null, null, null, null);
    }

    public ConnectionOptions connectionOptions() {
        return new ConnectionOptions(heartbeatInterval, maxReconnectAttempts, autoReconnect,
                new BackoffPolicy(BackoffPolicy.DEFAULT_BASE, maxBackoff));
    }
}
