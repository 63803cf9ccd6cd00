package io.github.drompincen.collabsync.protocol.api;

public record SessionPermissions(
        boolean allowEditing,
        boolean allowInviting,
        boolean allowMessaging,
        boolean requireApproval
) {
    public static SessionPermissions defaults() {
        return new SessionPermissions(true, true, true, false);
    }

    public SessionPermissions merge(PermissionOverrides overrides) {
        if (overrides == null) return this;
        return new SessionPermissions(
                overrides.allowEditing() != null ? overrides.allowEditing() : allowEditing,
                overrides.allowInviting() != null ? overrides.allowInviting() : allowInviting,
                overrides.allowMessaging() != null ? overrides.allowMessaging() : allowMessaging,
                overrides.requireApproval() != null ? overrides.requireApproval() : requireApproval);
    }
}
