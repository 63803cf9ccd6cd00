package io.github.drompincen.collabsync.protocol.api;

import java.time.Instant;
import java.util.List;

public record Session(
        String id,
        String name,
        String ownerId,
        List<Participant> participants,
        SessionPermissions permissions,
        SessionSettings settings,
        Instant createdAt,
        Instant updatedAt,
        boolean active,
        Instant expiresAt,
        String shareUrl
) {
    public Session {
        participants = participants == null ? List.of() : List.copyOf(participants);
        if (permissions == null) permissions = SessionPermissions.defaults();
        if (settings == null) settings = SessionSettings.defaults();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public Session withParticipants(List<Participant> newParticipants, Instant now) {
        return new Session(id, name, ownerId, newParticipants, permissions, settings,
                createdAt, now, active, expiresAt, shareUrl);
    }

    public Session withAccess(SessionPermissions newPermissions, SessionSettings newSettings, Instant now) {
        return new Session(id, name, ownerId, participants, newPermissions, newSettings,
                createdAt, now, active, expiresAt, shareUrl);
    }

    public Session withShare(String url, Instant newExpiresAt, Instant now) {
        return new Session(id, name, ownerId, participants, permissions, settings,
                createdAt, now, active, newExpiresAt != null ? newExpiresAt : expiresAt, url);
    }

    public Session deactivated(Instant now) {
        return new Session(id, name, ownerId, participants, permissions, settings,
                createdAt, now, false, expiresAt, shareUrl);
    }
}
