package io.github.drompincen.collabsync.protocol.api;

import java.time.Instant;
import java.util.Objects;

public record Participant(
        String id,
        String name,
        String email,
        String avatar,
        Role role,
        PresenceStatus status,
        Instant lastSeen,
        boolean typing,
        Cursor cursor
) {
    public Participant {
        Objects.requireNonNull(id, "id");
        if (role == null) role = Role.VIEWER;
        if (status == null) status = PresenceStatus.ONLINE;
    }

    public static Participant of(String id, String name, String email, Role role) {
        return new Participant(id, name, email, null, role, PresenceStatus.ONLINE, Instant.now(), false, null);
    }

    public Participant withRole(Role newRole) {
        return new Participant(id, name, email, avatar, newRole, status, lastSeen, typing, cursor);
    }

    public Participant withStatus(PresenceStatus newStatus, Instant seenAt) {
        return new Participant(id, name, email, avatar, role, newStatus, seenAt, typing, cursor);
    }

    public Participant withTyping(boolean isTyping) {
        return new Participant(id, name, email, avatar, role, status, lastSeen, isTyping, cursor);
    }

    public Participant withCursor(Cursor newCursor) {
        return new Participant(id, name, email, avatar, role, status, lastSeen, typing, newCursor);
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
