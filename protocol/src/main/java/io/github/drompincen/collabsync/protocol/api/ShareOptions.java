package io.github.drompincen.collabsync.protocol.api;

import java.util.List;

public record ShareOptions(
        PermissionOverrides permissions,
        SettingsOverrides settings,
        Integer expiresInHours,
        boolean requireAuth,
        List<String> allowedDomains
) {
    public ShareOptions {
        if (permissions == null) permissions = PermissionOverrides.none();
        if (settings == null) settings = SettingsOverrides.none();
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
    }

    public static ShareOptions defaults() {
        return new ShareOptions(null, null, null, false, List.of());
    }

    public static ShareOptions of(PermissionOverrides permissions, SettingsOverrides settings) {
        return new ShareOptions(permissions, settings, null, false, List.of());
    }
}
