package io.github.drompincen.collabsync.protocol.api;

import io.github.drompincen.collabsync.protocol.event.Event;

import java.time.Instant;
import java.util.List;

public record ConflictRecord(
        String id,
        String sessionId,
        List<Event> conflictingEvents,
        ResolutionStrategy strategy,
        boolean resolved,
        Instant detectedAt,
        ConflictResolution resolution
) {
    public ConflictRecord {
        conflictingEvents = conflictingEvents == null ? List.of() : List.copyOf(conflictingEvents);
        if (strategy == null) strategy = ResolutionStrategy.MERGE;
    }

    public ConflictRecord resolve(ConflictResolution detail) {
        return new ConflictRecord(id, sessionId, conflictingEvents, strategy, true, detectedAt, detail);
    }
}
