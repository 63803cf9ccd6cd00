package io.github.drompincen.collabsync.runtime.presence;

import io.github.drompincen.collabsync.protocol.api.PresenceInfo;
import io.github.drompincen.collabsync.protocol.api.PresencePatch;
import io.github.drompincen.collabsync.protocol.api.PresenceStatus;
import io.github.drompincen.collabsync.protocol.ws.WsMessage;
import io.github.drompincen.collabsync.runtime.connection.OutboundChannel;
import io.github.drompincen.collabsync.runtime.scheduler.ScheduledTask;
import io.github.drompincen.collabsync.runtime.scheduler.SyncScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cursor, selection and viewport of every participant. The local user's presence is broadcast at most
 * once per debounce window; presence is never queued while offline.
 */
public class PresenceTracker {

    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(100);
    public static final Duration DEFAULT_STALE_AFTER = Duration.ofSeconds(30);

    private final OutboundChannel channel;
    private final SyncScheduler scheduler;
    private final Clock clock;
    private final Duration debounce;
    private final Duration staleAfter;

    private final Map<String, PresenceInfo> presence = new LinkedHashMap<>();
    private String localUserId;
    private ScheduledTask pendingBroadcast;

    public PresenceTracker(OutboundChannel channel, SyncScheduler scheduler, Clock clock,
                           Duration debounce, Duration staleAfter) {
        this.channel = channel;
        this.scheduler = scheduler;
        this.clock = clock;
        this.debounce = debounce != null ? debounce : DEFAULT_DEBOUNCE;
        this.staleAfter = staleAfter != null ? staleAfter : DEFAULT_STALE_AFTER;
    }

    public PresenceInfo update(String userId, String sessionId, PresencePatch patch) {
        PresenceInfo previous = presence.get(userId);
        PresenceInfo merged = new PresenceInfo(
                userId,
                sessionId,
                patch.cursor() != null ? patch.cursor() : previous != null ? previous.cursor() : null,
                patch.selection() != null ? patch.selection() : previous != null ? previous.selection() : null,
                patch.viewport() != null ? patch.viewport() : previous != null ? previous.viewport() : null,
                patch.lastActivity() != null ? patch.lastActivity() : clock.instant());
        localUserId = userId;
        presence.put(userId, merged);

        if (pendingBroadcast == null) {
            pendingBroadcast = scheduler.schedule(this::broadcast, debounce);
        }
        return merged;
    }

    public void receive(PresenceInfo remote) {
        if (remote.userId() == null) {
            log.warn("Dropping presence update without user id");
            return;
        }
        if (remote.userId().equals(localUserId)) {
            return;
        }
        presence.put(remote.userId(), remote);
    }

    public void remove(String userId) {
        presence.remove(userId);
    }

    public Optional<PresenceInfo> presenceOf(String userId) {
        return Optional.ofNullable(presence.get(userId));
    }

    public Map<String, PresenceInfo> snapshot() {
        return Map.copyOf(presence);
    }

    public boolean isStale(String userId) {
        PresenceInfo info = presence.get(userId);
        if (info == null || info.lastActivity() == null) return false;
        return info.lastActivity().plus(staleAfter).isBefore(clock.instant());
    }

    /**
     * Status shown for a participant: presence older than the stale window turns ONLINE into AWAY.
     */
    public PresenceStatus effectiveStatus(String userId, PresenceStatus reported) {
        if (reported == PresenceStatus.ONLINE && isStale(userId)) {
            return PresenceStatus.AWAY;
        }
        return reported;
    }

    public void cancelPending() {
        if (pendingBroadcast != null) {
            pendingBroadcast.cancel();
            pendingBroadcast = null;
        }
    }

    public void clear() {
        cancelPending();
        presence.clear();
        localUserId = null;
    }

    private void broadcast() {
        pendingBroadcast = null;
        PresenceInfo local = localUserId != null ? presence.get(localUserId) : null;
        if (local == null) {
            return;
        }
        if (!channel.send(new WsMessage.PresenceUpdate(local))) {
            log.debug("Presence for {} dropped while offline", localUserId);
        }
    }
}
