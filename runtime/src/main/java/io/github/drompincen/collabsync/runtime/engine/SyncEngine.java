package io.github.drompincen.collabsync.runtime.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.collabsync.protocol.api.ConflictRecord;
import io.github.drompincen.collabsync.protocol.api.Operation;
import io.github.drompincen.collabsync.protocol.api.Participant;
import io.github.drompincen.collabsync.protocol.api.PresenceInfo;
import io.github.drompincen.collabsync.protocol.api.PresencePatch;
import io.github.drompincen.collabsync.protocol.api.PresenceStatus;
import io.github.drompincen.collabsync.protocol.api.Session;
import io.github.drompincen.collabsync.protocol.api.SettingsOverrides;
import io.github.drompincen.collabsync.protocol.api.ShareOptions;
import io.github.drompincen.collabsync.protocol.error.StateException;
import io.github.drompincen.collabsync.protocol.event.Event;
import io.github.drompincen.collabsync.protocol.event.EventPayload;
import io.github.drompincen.collabsync.protocol.event.EventPayload.SyncAction;
import io.github.drompincen.collabsync.protocol.ws.WireCodec;
import io.github.drompincen.collabsync.protocol.ws.WsMessage;
import io.github.drompincen.collabsync.runtime.conflict.ConflictDetector;
import io.github.drompincen.collabsync.runtime.connection.ConnectionListener;
import io.github.drompincen.collabsync.runtime.connection.ConnectionManager;
import io.github.drompincen.collabsync.runtime.connection.ConnectionState;
import io.github.drompincen.collabsync.runtime.connection.TransportFactory;
import io.github.drompincen.collabsync.runtime.event.EventDraft;
import io.github.drompincen.collabsync.runtime.event.EventLog;
import io.github.drompincen.collabsync.runtime.event.EventOutcome;
import io.github.drompincen.collabsync.runtime.notify.Notification;
import io.github.drompincen.collabsync.runtime.notify.NotificationCenter;
import io.github.drompincen.collabsync.runtime.notify.NotificationType;
import io.github.drompincen.collabsync.runtime.ot.OperationDraft;
import io.github.drompincen.collabsync.runtime.ot.OperationOutcome;
import io.github.drompincen.collabsync.runtime.ot.OperationPipeline;
import io.github.drompincen.collabsync.runtime.presence.PresenceTracker;
import io.github.drompincen.collabsync.runtime.profile.ClientProfile;
import io.github.drompincen.collabsync.runtime.profile.ProfileStore;
import io.github.drompincen.collabsync.runtime.scheduler.SerialGuard;
import io.github.drompincen.collabsync.runtime.scheduler.SyncScheduler;
import io.github.drompincen.collabsync.runtime.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * One collaborative session as seen by one client.
 *
 * <p>Wires the connection manager, event log, operation pipeline, conflict detector, presence tracker,
 * session registry and notification center together. Every public method, inbound frame and timer
 * callback runs to completion under a single monitor before the next one starts.
 */
public class SyncEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final SerialGuard guard = new SerialGuard();
    private final SyncSettings settings;
    private final ProfileStore profileStore;
    private final Clock clock;

    private final NotificationCenter notifications;
    private final SessionRegistry registry;
    private final ConnectionManager connection;
    private final ConflictDetector conflicts;
    private final EventLog eventLog;
    private final OperationPipeline operations;
    private final PresenceTracker presence;
    private final List<SyncListener> listeners = new CopyOnWriteArrayList<>();

    private boolean syncEnabled = true;
    private boolean autoReconnect;
    private String lastSessionId;

    public SyncEngine(SyncSettings settings, TransportFactory transportFactory, SyncScheduler scheduler,
                      ProfileStore profileStore, Clock clock, WireCodec codec) {
        this.settings = settings;
        this.profileStore = profileStore;
        this.clock = clock;
        this.autoReconnect = settings.autoReconnect();

        SyncScheduler timers = guard.guard(scheduler);
        this.notifications = new NotificationCenter(timers, clock, settings.notificationTtl());
        this.registry = new SessionRegistry(clock, settings.shareBaseUrl());
        this.connection = new ConnectionManager(transportFactory, timers, clock, codec, guard,
                new InboundHandler(), settings.connectionOptions());
        this.conflicts = new ConflictDetector(registry, notifications, guard, clock);
        this.eventLog = new EventLog(this::transmit, conflicts, this::applyEffects, clock);
        this.operations = new OperationPipeline(this::transmit, clock);
        this.presence = new PresenceTracker(this::transmit, timers, clock,
                settings.presenceDebounce(), settings.presenceStaleAfter());

        notifications.addListener(n -> fire(l -> l.onNotification(n)));
        conflicts.addListener(c -> fire(l -> l.onConflict(c)));
    }

    // --- profile ---

    public Optional<ClientProfile> restoreProfile() {
        return guard.call(() -> {
            Optional<ClientProfile> profile;
            try {
                profile = profileStore.load(settings.profileId());
            } catch (RuntimeException e) {
                log.warn("Failed to load profile {}: {}", settings.profileId(), e.getMessage());
                return Optional.empty();
            }
            profile.ifPresent(p -> {
                if (p.user() != null) registry.initialize(p.user());
                lastSessionId = p.lastSessionId();
                syncEnabled = p.syncEnabled();
                autoReconnect = p.autoReconnect();
                connection.setAutoReconnect(autoReconnect);
                log.info("Restored profile {} (user {})", p.profileId(), p.user() != null ? p.user().id() : "-");
            });
            return profile;
        });
    }

    public void initialize(Participant user) {
        guard.run(() -> {
            registry.initialize(user);
            saveProfile();
            log.info("Initialized as {}", user.id());
        });
    }

    public void updatePreferences(Boolean syncEnabled, Boolean autoReconnect) {
        guard.run(() -> {
            if (autoReconnect != null) {
                this.autoReconnect = autoReconnect;
                connection.setAutoReconnect(autoReconnect);
            }
            if (syncEnabled != null && syncEnabled != this.syncEnabled) {
                this.syncEnabled = syncEnabled;
                log.info("Sync {}", syncEnabled ? "resumed" : "paused");
                if (syncEnabled) flushQueues();
            }
            saveProfile();
        });
    }

    // --- connection ---

    public void connect(URI endpoint) {
        connection.connect(endpoint);
    }

    public void disconnect() {
        guard.run(() -> {
            presence.cancelPending();
            connection.disconnect();
        });
    }

    public void reconnect() {
        connection.reconnect();
    }

    // --- session lifecycle ---

    public Session createSession(String name, ShareOptions options) {
        return guard.call(() -> {
            registry.requireCurrentUser();
            if (registry.sessionId() != null) {
                endSessionLocally();
            }
            Session session = registry.createSession(name, options);
            Participant owner = registry.requireCurrentUser();
            connection.send(new WsMessage.JoinSession(session.id(), owner));
            eventLog.sendEvent(new EventDraft(session.id(), owner.id(),
                    new EventPayload.SessionSync(SyncAction.CREATE, session), eventLog.baseVersion() + 1));
            lastSessionId = session.id();
            saveProfile();
            return session;
        });
    }

    public void joinSession(String sessionId, Participant user) {
        guard.run(() -> {
            if (!connection.isConnected()) {
                throw new StateException("Cannot join session " + sessionId + " while disconnected");
            }
            String current = registry.sessionId();
            if (current != null && !current.equals(sessionId)) {
                throw new StateException("Already in session " + current);
            }
            registry.join(sessionId, user);
            connection.send(new WsMessage.JoinSession(sessionId, user));
            notifications.add(NotificationType.USER_JOINED, "Joined Session", "You joined the session");
            log.info("Joined session {} as {}", sessionId, user.id());
            lastSessionId = sessionId;
            saveProfile();
            eventLog.requestSync(sessionId, eventLog.baseVersion());
        });
    }

    public void leaveSession(String sessionId) {
        guard.run(() -> {
            Participant user = registry.requireCurrentUser();
            if (!connection.isConnected()) {
                throw new StateException("Cannot leave session " + sessionId + " while disconnected");
            }
            if (!sessionId.equals(registry.sessionId())) {
                throw new StateException("Not in session " + sessionId);
            }
            connection.send(new WsMessage.LeaveSession(sessionId, user.id()));
            endSessionLocally();
            log.info("Left session {}", sessionId);
            lastSessionId = null;
            saveProfile();
        });
    }

    public String shareSession(String sessionId, ShareOptions options) {
        return guard.call(() -> {
            String url = registry.share(sessionId, options);
            announceSession(SyncAction.UPDATE, registry.session().orElseThrow());
            log.info("Shared session {} at {}", sessionId, url);
            return url;
        });
    }

    public Session updateSessionSettings(SettingsOverrides overrides) {
        return guard.call(() -> {
            Session updated = registry.updateSettings(overrides);
            announceSession(SyncAction.UPDATE, updated);
            return updated;
        });
    }

    public void deleteSession() {
        guard.run(() -> {
            Session deleted = registry.deleteSession();
            announceSession(SyncAction.DELETE, deleted);
            endSessionLocally();
            lastSessionId = null;
            saveProfile();
            log.info("Deleted session {}", deleted.id());
        });
    }

    public Participant updateUserStatus(String userId, PresenceStatus status) {
        return guard.call(() -> registry.updateUserStatus(userId, status));
    }

    public Event setTypingStatus(boolean typing) {
        return guard.call(() -> {
            Participant user = registry.requireCurrentUser();
            String sessionId = registry.requireInSession();
            EventPayload payload = typing ? new EventPayload.TypingStart() : new EventPayload.TypingStop();
            return eventLog.sendEvent(EventDraft.of(sessionId, user.id(), payload));
        });
    }

    // --- messages and events ---

    public Event sendMessage(String content) {
        return guard.call(() -> sendChat(new EventPayload.MessageSent(UUID.randomUUID().toString(), content)));
    }

    public Event editMessage(String messageId, String content) {
        return guard.call(() -> sendChat(new EventPayload.MessageEdited(messageId, content)));
    }

    public Event deleteMessage(String messageId) {
        return guard.call(() -> sendChat(new EventPayload.MessageDeleted(messageId)));
    }

    public Event sendEvent(EventDraft draft) {
        return guard.call(() -> eventLog.sendEvent(draft));
    }

    public EventOutcome processEvent(Event event) {
        return guard.call(() -> eventLog.processEvent(event));
    }

    public void acknowledgeEvent(String eventId) {
        guard.run(() -> eventLog.acknowledgeEvent(eventId));
    }

    public CompletableFuture<Long> requestSync(long fromVersion) {
        return guard.call(() -> eventLog.requestSync(registry.sessionId(), fromVersion));
    }

    public void handleSyncResponse(List<Event> events, long version) {
        guard.run(() -> eventLog.handleSyncResponse(events, version));
    }

    // --- document ---

    public Operation submitOperation(OperationDraft draft) {
        return guard.call(() -> {
            registry.requireEditor();
            return operations.submit(draft, registry.currentUserId());
        });
    }

    public OperationOutcome applyOperation(Operation operation) {
        return guard.call(() -> operations.receive(operation));
    }

    public void loadDocument(String text, long version) {
        guard.run(() -> operations.load(text, version));
    }

    // --- presence ---

    public PresenceInfo updatePresence(PresencePatch patch) {
        return guard.call(() -> {
            Participant user = registry.requireCurrentUser();
            return presence.update(user.id(), registry.sessionId(), patch);
        });
    }

    public PresenceStatus effectiveStatus(String userId) {
        return guard.call(() -> registry.participant(userId)
                .map(p -> presence.effectiveStatus(userId, p.status()))
                .orElse(PresenceStatus.OFFLINE));
    }

    // --- conflicts ---

    public Optional<ConflictRecord> detectConflict(List<Event> events) {
        return guard.call(() -> conflicts.detectConflict(events, eventLog.baseVersion()));
    }

    public ConflictRecord resolveConflict(String conflictId, JsonNode resolution) {
        return guard.call(() -> conflicts.resolveConflict(conflictId, resolution));
    }

    // --- notifications ---

    public boolean dismissNotification(String notificationId) {
        return guard.call(() -> notifications.dismiss(notificationId));
    }

    public void clearNotifications() {
        guard.run(notifications::clear);
    }

    // --- listeners ---

    public void addListener(SyncListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SyncListener listener) {
        listeners.remove(listener);
    }

    // --- snapshots ---

    public ConnectionState connectionState() {
        return connection.state();
    }

    public int reconnectAttempts() {
        return connection.reconnectAttempts();
    }

    public Instant lastHeartbeat() {
        return connection.lastHeartbeat();
    }

    public long baseVersion() {
        return guard.call(eventLog::baseVersion);
    }

    public Optional<Participant> currentUser() {
        return guard.call(registry::currentUser);
    }

    public Optional<Session> session() {
        return guard.call(registry::session);
    }

    public List<Participant> participants() {
        return guard.call(registry::participants);
    }

    public boolean isSessionOwner(String userId) {
        return guard.call(() -> registry.isSessionOwner(userId));
    }

    public boolean canEdit(String userId) {
        return guard.call(() -> registry.canEdit(userId));
    }

    public Map<String, PresenceInfo> presence() {
        return guard.call(presence::snapshot);
    }

    public List<Event> history() {
        return guard.call(eventLog::history);
    }

    public List<Event> pendingEvents() {
        return guard.call(eventLog::pendingEvents);
    }

    public List<ConflictRecord> conflicts() {
        return guard.call(conflicts::conflicts);
    }

    public List<Notification> notifications() {
        return guard.call(notifications::active);
    }

    public String text() {
        return guard.call(operations::text);
    }

    public String confirmedText() {
        return guard.call(operations::confirmedText);
    }

    public List<Operation> pendingOperations() {
        return guard.call(operations::pendingOperations);
    }

    public boolean isSyncEnabled() {
        return guard.call(() -> syncEnabled);
    }

    public String lastSessionId() {
        return guard.call(() -> lastSessionId);
    }

    @Override
    public void close() {
        guard.run(() -> {
            presence.clear();
            connection.disconnect();
            notifications.clear();
        });
    }

    // --- internals ---

    private boolean transmit(WsMessage message) {
        return syncEnabled && connection.send(message);
    }

    private Event sendChat(EventPayload payload) {
        registry.requireMessaging();
        return eventLog.sendEvent(EventDraft.of(registry.sessionId(), registry.currentUserId(), payload));
    }

    private void announceSession(SyncAction action, Session session) {
        eventLog.sendEvent(EventDraft.of(session.id(), registry.currentUserId(),
                new EventPayload.SessionSync(action, session)));
    }

    private void flushQueues() {
        if (!connection.isConnected()) {
            return;
        }
        eventLog.flushPending();
        operations.flushPending();
    }

    private void endSessionLocally() {
        registry.endSession();
        presence.clear();
        eventLog.reset();
        operations.clear();
        conflicts.clear();
    }

    private void applyEffects(Event event, boolean local) {
        EventPayload payload = event.payload();
        if (payload instanceof EventPayload.UserJoined joined) {
            Participant user = joined.user();
            boolean known = registry.participant(user.id()).isPresent();
            registry.putParticipant(user);
            if (!local && !known && !user.id().equals(registry.currentUserId())) {
                notifications.add(NotificationType.USER_JOINED, "User Joined",
                        user.displayName() + " joined the session");
            }
        } else if (payload instanceof EventPayload.UserLeft left) {
            String self = registry.currentUserId();
            if (self != null && self.equals(left.userId()) && registry.sessionId() != null) {
                // The relay logs our own socket drops; we are still here until we leave explicitly.
                log.debug("Ignoring departure of local user {} from session {}", left.userId(), registry.sessionId());
                return;
            }
            presence.remove(left.userId());
            registry.removeParticipant(left.userId()).ifPresent(p ->
                    notifications.add(NotificationType.USER_LEFT, "User Left",
                            p.displayName() + " left the session"));
            if (registry.participants().isEmpty() && registry.sessionId() != null) {
                log.info("Last participant left session {}", registry.sessionId());
                registry.endSession();
                presence.clear();
            }
        } else if (payload instanceof EventPayload.TypingStart) {
            registry.setTyping(event.authorId(), true);
        } else if (payload instanceof EventPayload.TypingStop) {
            registry.setTyping(event.authorId(), false);
        } else if (payload instanceof EventPayload.CursorMove move) {
            registry.updateCursor(event.authorId(), move.cursor());
        } else if (payload instanceof EventPayload.SessionSync sync) {
            registry.adoptSession(sync.action(), sync.session());
        }
    }

    private void fire(Consumer<SyncListener> callback) {
        for (SyncListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Sync listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private void saveProfile() {
        ClientProfile profile = new ClientProfile(settings.profileId(), registry.currentUser().orElse(null),
                lastSessionId, syncEnabled, autoReconnect, clock.instant());
        try {
            profileStore.save(profile);
        } catch (RuntimeException e) {
            log.warn("Failed to save profile {}: {}", settings.profileId(), e.getMessage());
        }
    }

    private final class InboundHandler implements ConnectionListener {

        @Override
        public void onStateChanged(ConnectionState previous, ConnectionState current) {
            announceConnectionState(previous, current);
            if (current == ConnectionState.CONNECTED) {
                resumeSession();
            } else if (previous == ConnectionState.CONNECTED) {
                presence.cancelPending();
            }
            fire(l -> l.onConnectionStateChanged(previous, current));
        }

        @Override
        public void onMessage(WsMessage message) {
            if (registry.expireIfDue()) {
                endSessionLocally();
            }
            if (message instanceof WsMessage.EventMessage em) {
                Event event = em.event();
                if (isForeign(event.sessionId())) {
                    log.debug("Ignoring event {} for session {}", event.id(), event.sessionId());
                    return;
                }
                eventLog.processEvent(event);
            } else if (message instanceof WsMessage.OperationMessage om) {
                operations.receive(om.operation());
            } else if (message instanceof WsMessage.PresenceUpdate pu) {
                if (!isForeign(pu.presence().sessionId())) presence.receive(pu.presence());
            } else if (message instanceof WsMessage.SyncResponse sr) {
                if (isForeign(sr.sessionId())) {
                    log.debug("Ignoring sync response for session {}", sr.sessionId());
                    return;
                }
                eventLog.handleSyncResponse(sr.events(), sr.version());
            } else if (message instanceof WsMessage.ConflictMessage cm) {
                conflicts.recordRemote(cm.conflict());
            } else if (message instanceof WsMessage.ErrorMessage err) {
                log.error("Relay error {}: {}", err.code(), err.error());
                notifications.add(NotificationType.SYNC_ERROR, "Sync Error",
                        err.error() != null ? err.error() : "Relay reported an error");
            } else {
                log.debug("Ignoring {} from relay", message.messageType());
            }
        }

        @Override
        public void onTransportError(Throwable error) {
            log.debug("Transport error surfaced as ERROR state: {}", error.getMessage());
        }

        private boolean isForeign(String sessionId) {
            return sessionId != null && registry.sessionId() != null && !sessionId.equals(registry.sessionId());
        }

        // Re-subscribe, flush what queued up while offline, then catch up on missed events.
        private void resumeSession() {
            String sessionId = registry.sessionId();
            Optional<Participant> user = registry.currentUser();
            if (sessionId != null && user.isPresent()) {
                connection.send(new WsMessage.JoinSession(sessionId, user.get()));
            }
            if (syncEnabled) {
                eventLog.flushPending();
                operations.flushPending();
            }
            if (sessionId != null) {
                eventLog.requestSync(sessionId, eventLog.baseVersion());
            }
        }

        private void announceConnectionState(ConnectionState previous, ConnectionState current) {
            switch (current) {
                case CONNECTING -> notifications.add(NotificationType.CONNECTION_STATUS, "Connecting",
                        "Connecting to the collaboration server");
                case CONNECTED -> notifications.add(NotificationType.CONNECTION_STATUS, "Connected",
                        "Real-time collaboration is active");
                case DISCONNECTED -> notifications.add(NotificationType.CONNECTION_STATUS, "Disconnected",
                        previous == ConnectionState.CONNECTED ? "Connection lost" : "Connection closed");
                case RECONNECTING -> notifications.add(NotificationType.CONNECTION_STATUS, "Reconnecting",
                        "Reconnect attempt " + connection.reconnectAttempts());
                case ERROR -> notifications.add(NotificationType.SYNC_ERROR, "Connection Error",
                        "Failed to connect to the collaboration server");
            }
        }
    }
}
