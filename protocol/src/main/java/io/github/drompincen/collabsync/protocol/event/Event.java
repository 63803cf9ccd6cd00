package io.github.drompincen.collabsync.protocol.event;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.util.Objects;

@JsonDeserialize(using = EventDeserializer.class)
public record Event(
        String id,
        EventType type,
        String sessionId,
        String authorId,
        Instant timestamp,
        EventPayload payload,
        long version,
        boolean acknowledged
) {
    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        if (type == null) {
            type = payload.eventType();
        } else if (type != payload.eventType()) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                    + " does not match event type " + type);
        }
    }

    public Event acknowledge() {
        return new Event(id, type, sessionId, authorId, timestamp, payload, version, true);
    }

    public Event withVersion(long newVersion) {
        return new Event(id, type, sessionId, authorId, timestamp, payload, newVersion, acknowledged);
    }
}
