package io.github.drompincen.collabsync.runtime.event;

import io.github.drompincen.collabsync.protocol.api.ConflictRecord;
import io.github.drompincen.collabsync.protocol.error.StateException;
import io.github.drompincen.collabsync.protocol.event.Event;
import io.github.drompincen.collabsync.protocol.ws.WsMessage;
import io.github.drompincen.collabsync.runtime.conflict.ConflictDetector;
import io.github.drompincen.collabsync.runtime.connection.OutboundChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Ordered event history with the acknowledgement protocol.
 *
 * <p>Local events take effect immediately as tentative events and are reconciled when the relay echoes
 * them back. Events that cannot be sent are queued and flushed in submission order on reconnect.
 * Inbound events go through {@link #processEvent(Event)}, which is idempotent per event id. Ids are
 * remembered only down to the base version; anything older is rejected as stale anyway.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    public static final int HISTORY_LIMIT = 1000;

    private final OutboundChannel channel;
    private final ConflictDetector conflicts;
    private final EventEffects effects;
    private final Clock clock;

    private final Deque<Event> history = new ArrayDeque<>();
    private final List<Event> pending = new ArrayList<>();
    private final Map<String, Event> tentative = new LinkedHashMap<>();
    private final Map<String, Long> acknowledged = new HashMap<>();
    private final List<CompletableFuture<Long>> syncWaiters = new ArrayList<>();
    private long baseVersion;

    public EventLog(OutboundChannel channel, ConflictDetector conflicts, EventEffects effects, Clock clock) {
        this.channel = channel;
        this.conflicts = conflicts;
        this.effects = effects;
        this.clock = clock;
    }

    public Event sendEvent(EventDraft draft) {
        long version = draft.version() != null ? draft.version() : baseVersion;
        Event event = new Event(UUID.randomUUID().toString(), null, draft.sessionId(), draft.authorId(),
                clock.instant(), draft.payload(), version, false);

        effects.apply(event, true);
        tentative.put(event.id(), event);
        if (channel.send(new WsMessage.EventMessage(event))) {
            appendHistory(event);
        } else {
            pending.add(event);
            log.debug("Queued {} event {} ({} pending)", event.type(), event.id(), pending.size());
        }
        return event;
    }

    /**
     * Sends queued events in submission order. Stops at the first refused send and keeps the rest.
     *
     * @return how many events went out
     */
    public int flushPending() {
        int flushed = 0;
        Iterator<Event> it = pending.iterator();
        while (it.hasNext()) {
            Event event = it.next();
            if (!channel.send(new WsMessage.EventMessage(event))) {
                break;
            }
            it.remove();
            appendHistory(event);
            flushed++;
        }
        if (flushed > 0) log.info("Flushed {} queued events", flushed);
        return flushed;
    }

    public EventOutcome processEvent(Event event) {
        if (acknowledged.containsKey(event.id())) {
            return EventOutcome.DUPLICATE;
        }

        Event local = tentative.remove(event.id());
        if (local != null) {
            acknowledged.put(event.id(), event.version());
            confirmInHistory(event.acknowledge());
            advanceBaseVersion(event.version());
            log.debug("Reconciled local {} event {} at version {}", event.type(), event.id(), event.version());
            return EventOutcome.RECONCILED;
        }

        if (event.version() < baseVersion) {
            log.debug("Rejected stale {} event {} (version {} < base {})",
                    event.type(), event.id(), event.version(), baseVersion);
            return EventOutcome.STALE;
        }

        if (conflicts.isParked(event.id())) {
            return EventOutcome.CONFLICTED;
        }
        Optional<ConflictRecord> conflict = conflicts.detectConflict(List.of(event), baseVersion);
        if (conflict.isPresent()) {
            conflicts.park(conflict.get());
            return EventOutcome.CONFLICTED;
        }

        effects.apply(event, false);
        appendHistory(event.acknowledge());
        acknowledged.put(event.id(), event.version());
        advanceBaseVersion(event.version());
        return EventOutcome.APPLIED;
    }

    public void acknowledgeEvent(String eventId) {
        Event local = tentative.remove(eventId);
        acknowledged.put(eventId, local != null ? Math.max(local.version(), baseVersion) : baseVersion);
        pending.removeIf(e -> e.id().equals(eventId));
        if (local != null) {
            confirmInHistory(local.acknowledge());
        }
    }

    public CompletableFuture<Long> requestSync(String sessionId, long fromVersion) {
        if (sessionId == null) {
            return CompletableFuture.failedFuture(new StateException("Not in a session"));
        }
        if (!channel.send(new WsMessage.SyncRequest(sessionId, fromVersion))) {
            return CompletableFuture.failedFuture(
                    new StateException("Sync request for " + sessionId + " could not be sent"));
        }
        CompletableFuture<Long> waiter = new CompletableFuture<>();
        syncWaiters.add(waiter);
        log.debug("Requested sync of {} from version {}", sessionId, fromVersion);
        return waiter;
    }

    public void handleSyncResponse(List<Event> events, long version) {
        int applied = 0;
        for (Event event : events) {
            try {
                if (processEvent(event) == EventOutcome.APPLIED) applied++;
            } catch (RuntimeException e) {
                log.error("Failed to replay event {}", event.id(), e);
            }
        }
        advanceBaseVersion(version);
        log.info("Sync replayed {} of {} events, base version {}", applied, events.size(), baseVersion);

        List<CompletableFuture<Long>> waiters = new ArrayList<>(syncWaiters);
        syncWaiters.clear();
        waiters.forEach(w -> w.complete(baseVersion));
    }

    /** Forgets everything about the current session, e.g. after leaving it. */
    public void reset() {
        history.clear();
        pending.clear();
        tentative.clear();
        acknowledged.clear();
        baseVersion = 0;
        syncWaiters.forEach(w -> w.cancel(false));
        syncWaiters.clear();
    }

    public long baseVersion() {
        return baseVersion;
    }

    public List<Event> history() {
        return List.copyOf(history);
    }

    public List<Event> pendingEvents() {
        return List.copyOf(pending);
    }

    public List<Event> tentativeEvents() {
        return List.copyOf(tentative.values());
    }

    /** Whether an event at or above the base version has been acknowledged. */
    public boolean isAcknowledged(String eventId) {
        return acknowledged.containsKey(eventId);
    }

    int rememberedIdCount() {
        return acknowledged.size();
    }

    private void appendHistory(Event event) {
        history.addLast(event);
        while (history.size() > HISTORY_LIMIT) {
            history.removeFirst();
        }
    }

    // A confirmed event replaces its tentative copy and moves to the end, so history follows relay order.
    private void confirmInHistory(Event confirmed) {
        history.removeIf(e -> e.id().equals(confirmed.id()));
        appendHistory(confirmed);
    }

    // The base version never moves backwards.
    private void advanceBaseVersion(long version) {
        if (version > baseVersion) {
            baseVersion = version;
            acknowledged.values().removeIf(v -> v < baseVersion);
            conflicts.forgetParkedBefore(baseVersion);
        }
    }
}
