package io.github.drompincen.collabsync.protocol.api;

import java.time.Instant;

/**
 * Partial presence update for the local user. {@code null} fields keep the last known value.
 */
public record PresencePatch(
        Cursor cursor,
        Selection selection,
        Viewport viewport,
        Instant lastActivity
) {
    public static PresencePatch cursor(Cursor cursor) {
        return new PresencePatch(cursor, null, null, null);
    }

    public static PresencePatch viewport(Viewport viewport) {
        return new PresencePatch(null, null, viewport, null);
    }
}
