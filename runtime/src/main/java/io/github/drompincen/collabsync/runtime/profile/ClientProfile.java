package io.github.drompincen.collabsync.runtime.profile;

import io.github.drompincen.collabsync.protocol.api.Participant;

import java.time.Instant;
import java.util.Objects;

/**
 * What a client remembers across restarts: who the user is, the last session and sync preferences.
 */
public record ClientProfile(
        String profileId,
        Participant user,
        String lastSessionId,
        boolean syncEnabled,
        boolean autoReconnect,
        Instant updatedAt
) {

    public ClientProfile {
        Objects.requireNonNull(profileId, "profileId");
    }
}
