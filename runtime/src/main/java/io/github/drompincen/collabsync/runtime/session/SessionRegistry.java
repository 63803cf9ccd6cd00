package io.github.drompincen.collabsync.runtime.session;

import io.github.drompincen.collabsync.protocol.api.Cursor;
import io.github.drompincen.collabsync.protocol.api.Participant;
import io.github.drompincen.collabsync.protocol.api.PresenceStatus;
import io.github.drompincen.collabsync.protocol.api.Role;
import io.github.drompincen.collabsync.protocol.api.Session;
import io.github.drompincen.collabsync.protocol.api.SessionPermissions;
import io.github.drompincen.collabsync.protocol.api.SessionSettings;
import io.github.drompincen.collabsync.protocol.api.SettingsOverrides;
import io.github.drompincen.collabsync.protocol.api.ShareOptions;
import io.github.drompincen.collabsync.protocol.error.PermissionException;
import io.github.drompincen.collabsync.protocol.error.StateException;
import io.github.drompincen.collabsync.protocol.event.EventPayload.SyncAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Local view of the current session: who the user is, which session they are in, who else is there and
 * what each of them may do.
 *
 * <p>The participant map is driven only by joins and leaves; session snapshots received from peers update
 * metadata (name, permissions, settings, share link) but never membership.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Clock clock;
    private final String shareBaseUrl;

    private Participant currentUser;
    private String sessionId;
    private Session session;
    private final Map<String, Participant> participants = new LinkedHashMap<>();

    public SessionRegistry(Clock clock, String shareBaseUrl) {
        this.clock = clock;
        this.shareBaseUrl = stripTrailingSlash(shareBaseUrl);
    }

    public void initialize(Participant user) {
        currentUser = user;
        participants.put(user.id(), user);
    }

    public Optional<Participant> currentUser() {
        return Optional.ofNullable(currentUser);
    }

    public String currentUserId() {
        return currentUser != null ? currentUser.id() : null;
    }

    public Participant requireCurrentUser() {
        if (currentUser == null) {
            throw new StateException("No current user; initialize the engine with a user first");
        }
        return currentUser;
    }

    public Session createSession(String name, ShareOptions options) {
        Participant user = requireCurrentUser();
        ShareOptions opts = options != null ? options : ShareOptions.defaults();
        Instant now = clock.instant();

        Participant owner = user.withRole(Role.OWNER);
        currentUser = owner;
        participants.clear();
        participants.put(owner.id(), owner);

        session = new Session(UUID.randomUUID().toString(), name, owner.id(), List.of(owner),
                SessionPermissions.defaults().merge(opts.permissions()),
                SessionSettings.defaults().merge(opts.settings()),
                now, now, true, expiry(opts, now), null);
        sessionId = session.id();
        log.info("Created session {} ({}) owned by {}", sessionId, name, owner.id());
        return session().orElseThrow();
    }

    public void join(String targetSessionId, Participant user) {
        if (!targetSessionId.equals(sessionId)) {
            participants.clear();
            session = null;
        }
        sessionId = targetSessionId;
        currentUser = user;
        participants.put(user.id(), user);
    }

    /** Forgets the session locally; the current user stays initialized. */
    public void endSession() {
        session = null;
        sessionId = null;
        participants.clear();
    }

    public String share(String targetSessionId, ShareOptions options) {
        Session current = requireSession(targetSessionId);
        Participant user = requireCurrentUser();
        ShareOptions opts = options != null ? options : ShareOptions.defaults();
        boolean owner = isSessionOwner(user.id());

        if (!owner && !(roleOf(user.id()) == Role.EDITOR && current.permissions().allowInviting())) {
            throw new PermissionException(user.id(), "Not allowed to share session " + current.id());
        }
        if (!owner && !opts.settings().isEmpty()) {
            throw new PermissionException(user.id(), "Only the session owner can change session settings");
        }

        Instant now = clock.instant();
        String url = shareBaseUrl + "/collaborate/" + current.id();
        session = current
                .withAccess(current.permissions().merge(opts.permissions()),
                        current.settings().merge(opts.settings()), now)
                .withShare(url, expiry(opts, now), now);
        return url;
    }

    public Session updateSettings(SettingsOverrides overrides) {
        Session current = requireSession(sessionId);
        requireOwner("change session settings");
        session = current.withAccess(current.permissions(), current.settings().merge(overrides), clock.instant());
        return session().orElseThrow();
    }

    /**
     * Ends the session locally and returns the deactivated snapshot to announce to peers.
     */
    public Session deleteSession() {
        Session current = requireSession(sessionId);
        requireOwner("delete the session");
        Session deleted = current.withParticipants(List.copyOf(participants.values()), clock.instant())
                .deactivated(clock.instant());
        endSession();
        return deleted;
    }

    public void adoptSession(SyncAction action, Session snapshot) {
        if (snapshot == null) {
            return;
        }
        if (sessionId != null && !sessionId.equals(snapshot.id())) {
            log.debug("Ignoring {} for foreign session {}", action, snapshot.id());
            return;
        }
        if (action == SyncAction.DELETE) {
            log.info("Session {} was deleted", snapshot.id());
            endSession();
            return;
        }
        session = snapshot;
        sessionId = snapshot.id();
    }

    /**
     * Ends the session when its expiry has passed.
     *
     * @return true if the session was expired and is now gone
     */
    public boolean expireIfDue() {
        if (session != null && session.isExpired(clock.instant())) {
            log.info("Session {} expired at {}", session.id(), session.expiresAt());
            endSession();
            return true;
        }
        return false;
    }

    public void putParticipant(Participant participant) {
        if (!participants.containsKey(participant.id()) && participants.size() >= settings().maxParticipants()) {
            log.warn("Session {} is above its limit of {} participants", sessionId, settings().maxParticipants());
        }
        participants.put(participant.id(), participant);
        if (currentUser != null && currentUser.id().equals(participant.id())) {
            currentUser = participant;
        }
    }

    public Optional<Participant> removeParticipant(String userId) {
        return Optional.ofNullable(participants.remove(userId));
    }

    public void setTyping(String userId, boolean typing) {
        participants.computeIfPresent(userId, (id, p) -> p.withTyping(typing));
    }

    public void updateCursor(String userId, Cursor cursor) {
        participants.computeIfPresent(userId, (id, p) -> p.withCursor(cursor));
    }

    public Participant updateUserStatus(String userId, PresenceStatus status) {
        Participant existing = participants.get(userId);
        if (existing == null) {
            throw new StateException("Unknown participant: " + userId);
        }
        Participant updated = existing.withStatus(status, clock.instant());
        putParticipant(updated);
        return updated;
    }

    public boolean canEdit(String userId) {
        Participant participant = participants.get(userId);
        return participant != null && participant.role().canEdit() && permissions().allowEditing();
    }

    public boolean isSessionOwner(String userId) {
        if (userId == null) return false;
        if (session != null) return userId.equals(session.ownerId());
        return roleOf(userId) == Role.OWNER;
    }

    public void requireEditor() {
        Participant user = requireCurrentUser();
        requireInSession();
        if (!canEdit(user.id())) {
            throw new PermissionException(user.id(), "User " + user.id() + " cannot edit this session");
        }
    }

    public void requireMessaging() {
        Participant user = requireCurrentUser();
        requireInSession();
        if (!permissions().allowMessaging()) {
            throw new PermissionException(user.id(), "Messaging is disabled in session " + sessionId);
        }
    }

    public void requireOwner(String action) {
        Participant user = requireCurrentUser();
        if (!isSessionOwner(user.id())) {
            throw new PermissionException(user.id(), "Only the session owner can " + action);
        }
    }

    public String requireInSession() {
        if (sessionId == null) {
            throw new StateException("Not in a session");
        }
        return sessionId;
    }

    public String sessionId() {
        return sessionId;
    }

    /** Latest known session snapshot with the current participant list. */
    public Optional<Session> session() {
        if (session == null) return Optional.empty();
        return Optional.of(session.withParticipants(List.copyOf(participants.values()), session.updatedAt()));
    }

    public List<Participant> participants() {
        return List.copyOf(participants.values());
    }

    public Optional<Participant> participant(String userId) {
        return Optional.ofNullable(participants.get(userId));
    }

    public SessionPermissions permissions() {
        return session != null ? session.permissions() : SessionPermissions.defaults();
    }

    public SessionSettings settings() {
        return session != null ? session.settings() : SessionSettings.defaults();
    }

    private Session requireSession(String targetSessionId) {
        if (session == null || !session.id().equals(targetSessionId)) {
            throw new StateException("Unknown session: " + targetSessionId);
        }
        return session;
    }

    private Role roleOf(String userId) {
        Participant participant = participants.get(userId);
        if (participant != null) return participant.role();
        return currentUser != null && currentUser.id().equals(userId) ? currentUser.role() : null;
    }

    private static Instant expiry(ShareOptions options, Instant now) {
        return options.expiresInHours() != null ? now.plus(Duration.ofHours(options.expiresInHours())) : null;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return "";
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
