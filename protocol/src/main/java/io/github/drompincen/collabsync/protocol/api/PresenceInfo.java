package io.github.drompincen.collabsync.protocol.api;

import java.time.Instant;

public record PresenceInfo(
        String userId,
        String sessionId,
        Cursor cursor,
        Selection selection,
        Viewport viewport,
        Instant lastActivity
) {
    public PresenceInfo {
        if (cursor == null) cursor = Cursor.origin();
        if (viewport == null) viewport = Viewport.top();
    }
}
