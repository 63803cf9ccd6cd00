package io.github.drompincen.collabsync.protocol.api;

public record SessionSettings(
        int maxParticipants,
        boolean allowAnonymous,
        boolean autoSave,
        long syncDelayMs,
        ConflictResolutionMode conflictResolutionMode
) {
    public static final int DEFAULT_MAX_PARTICIPANTS = 10;
    public static final long DEFAULT_SYNC_DELAY_MS = 500;

    public SessionSettings {
        if (conflictResolutionMode == null) conflictResolutionMode = ConflictResolutionMode.MANUAL;
    }

    public static SessionSettings defaults() {
        return new SessionSettings(DEFAULT_MAX_PARTICIPANTS, false, true,
                DEFAULT_SYNC_DELAY_MS, ConflictResolutionMode.MANUAL);
    }

    public SessionSettings merge(SettingsOverrides overrides) {
        if (overrides == null) return this;
        return new SessionSettings(
                overrides.maxParticipants() != null ? overrides.maxParticipants() : maxParticipants,
                overrides.allowAnonymous() != null ? overrides.allowAnonymous() : allowAnonymous,
                overrides.autoSave() != null ? overrides.autoSave() : autoSave,
                overrides.syncDelayMs() != null ? overrides.syncDelayMs() : syncDelayMs,
                overrides.conflictResolutionMode() != null
                        ? overrides.conflictResolutionMode() : conflictResolutionMode);
    }
}
