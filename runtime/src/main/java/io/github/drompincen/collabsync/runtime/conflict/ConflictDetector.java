package io.github.drompincen.collabsync.runtime.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.collabsync.protocol.api.ConflictRecord;
import io.github.drompincen.collabsync.protocol.api.ConflictResolution;
import io.github.drompincen.collabsync.protocol.api.ResolutionStrategy;
import io.github.drompincen.collabsync.protocol.error.StateException;
import io.github.drompincen.collabsync.protocol.event.Event;
import io.github.drompincen.collabsync.runtime.notify.NotificationAction;
import io.github.drompincen.collabsync.runtime.notify.NotificationCenter;
import io.github.drompincen.collabsync.runtime.notify.NotificationType;
import io.github.drompincen.collabsync.runtime.scheduler.SerialGuard;
import io.github.drompincen.collabsync.runtime.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Classifies concurrent events and keeps the set of open and resolved conflicts.
 *
 * <p>Detection never resolves anything: a detected conflict is parked together with its events and
 * waits for {@link #resolveConflict(String, JsonNode)}.
 */
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    public static final String RESOLVE_ACTION = "Resolve";

    private final SessionRegistry registry;
    private final NotificationCenter notifications;
    private final SerialGuard guard;
    private final Clock clock;
    private final Map<String, ConflictRecord> conflicts = new LinkedHashMap<>();
    private final Map<String, Long> parkedEventVersions = new HashMap<>();
    private final List<ConflictListener> listeners = new CopyOnWriteArrayList<>();

    public ConflictDetector(SessionRegistry registry, NotificationCenter notifications, SerialGuard guard, Clock clock) {
        this.registry = registry;
        this.notifications = notifications;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * A batch conflicts when one of its events was authored by someone else at exactly the version this
     * client has already applied.
     */
    public Optional<ConflictRecord> detectConflict(List<Event> events, long baseVersion) {
        String localUserId = registry.currentUserId();
        Event concurrent = null;
        for (Event event : events) {
            if (event.version() == baseVersion && !Objects.equals(event.authorId(), localUserId)) {
                concurrent = event;
                break;
            }
        }
        if (concurrent == null) {
            return Optional.empty();
        }
        ResolutionStrategy strategy = registry.session()
                .map(s -> s.settings().conflictResolutionMode().defaultStrategy())
                .orElse(ResolutionStrategy.MERGE);
        String sessionId = registry.sessionId() != null ? registry.sessionId() : concurrent.sessionId();
        return Optional.of(new ConflictRecord(UUID.randomUUID().toString(), sessionId, events, strategy,
                false, clock.instant(), null));
    }

    /** Stores a detected conflict and raises it. Its events are remembered so a replay does not raise it twice. */
    public void park(ConflictRecord conflict) {
        conflict.conflictingEvents().forEach(e -> parkedEventVersions.put(e.id(), e.version()));
        register(conflict);
    }

    public boolean isParked(String eventId) {
        return parkedEventVersions.containsKey(eventId);
    }

    /** Drops parked ids below {@code version}; a replay of those events is stale and never reaches detection. */
    public void forgetParkedBefore(long version) {
        parkedEventVersions.values().removeIf(v -> v < version);
    }

    int parkedCount() {
        return parkedEventVersions.size();
    }

    /** Conflict announced by a peer over the wire. */
    public void recordRemote(ConflictRecord conflict) {
        if (conflict.resolved()) {
            conflicts.put(conflict.id(), conflict);
            log.debug("Recorded resolved conflict {}", conflict.id());
            return;
        }
        register(conflict);
    }

    public ConflictRecord resolveConflict(String conflictId, JsonNode payload) {
        ConflictRecord conflict = conflicts.get(conflictId);
        if (conflict == null) {
            throw new StateException("Unknown conflict: " + conflictId);
        }
        ConflictRecord resolved = conflict.resolve(new ConflictResolution(registry.currentUserId(),
                clock.instant(), conflict.strategy(), payload));
        conflicts.put(conflictId, resolved);
        log.info("Conflict {} resolved by {} ({})", conflictId, registry.currentUserId(), conflict.strategy());
        return resolved;
    }

    public Optional<ConflictRecord> conflict(String conflictId) {
        return Optional.ofNullable(conflicts.get(conflictId));
    }

    public List<ConflictRecord> conflicts() {
        return List.copyOf(conflicts.values());
    }

    public List<ConflictRecord> unresolved() {
        List<ConflictRecord> open = new ArrayList<>();
        for (ConflictRecord c : conflicts.values()) {
            if (!c.resolved()) open.add(c);
        }
        return List.copyOf(open);
    }

    public void addListener(ConflictListener listener) {
        listeners.add(listener);
    }

    public void clear() {
        conflicts.clear();
        parkedEventVersions.clear();
    }

    private void register(ConflictRecord conflict) {
        conflicts.put(conflict.id(), conflict);
        log.warn("Conflict {} in session {} ({} events, strategy {})", conflict.id(), conflict.sessionId(),
                conflict.conflictingEvents().size(), conflict.strategy());

        NotificationAction resolve = new NotificationAction(RESOLVE_ACTION,
                guard.wrap(() -> resolveConflict(conflict.id(), null)));
        notifications.add(NotificationType.CONFLICT, "Conflict Detected",
                "Conflicting changes need to be resolved", List.of(resolve));
        for (ConflictListener listener : listeners) {
            try {
                listener.onConflict(conflict);
            } catch (RuntimeException e) {
                log.warn("Conflict listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
