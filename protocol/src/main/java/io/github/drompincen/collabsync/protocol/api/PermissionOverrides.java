package io.github.drompincen.collabsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Partial permission update. A {@code null} component keeps the current value.
 */
public record PermissionOverrides(
        Boolean allowEditing,
        Boolean allowInviting,
        Boolean allowMessaging,
        Boolean requireApproval
) {
    public static PermissionOverrides none() {
        return new PermissionOverrides(null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return allowEditing == null && allowInviting == null
                && allowMessaging == null && requireApproval == null;
    }
}
