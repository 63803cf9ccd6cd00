package io.github.drompincen.collabsync.runtime.event;

import io.github.drompincen.collabsync.protocol.event.EventPayload;

import java.util.Objects;

/**
 * A local event before the log stamps id, timestamp and version. A {@code null} version means "the
 * current base version".
 */
public record EventDraft(String sessionId, String authorId, EventPayload payload, Long version) {

    public EventDraft {
        Objects.requireNonNull(payload, "payload");
    }

    public static EventDraft of(String sessionId, String authorId, EventPayload payload) {
        return new EventDraft(sessionId, authorId, payload, null);
    }
}
