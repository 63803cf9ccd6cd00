package io.github.drompincen.collabsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record SettingsOverrides(
        Integer maxParticipants,
        Boolean allowAnonymous,
        Boolean autoSave,
        Long syncDelayMs,
        ConflictResolutionMode conflictResolutionMode
) {
    public static SettingsOverrides none() {
        return new SettingsOverrides(null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return maxParticipants == null && allowAnonymous == null && autoSave == null
                && syncDelayMs == null && conflictResolutionMode == null;
    }
}
