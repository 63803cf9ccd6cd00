package io.github.drompincen.collabsync.protocol.event;

import io.github.drompincen.collabsync.protocol.api.Cursor;
import io.github.drompincen.collabsync.protocol.api.Participant;
import io.github.drompincen.collabsync.protocol.api.Session;

import java.util.Objects;

/**
 * Typed event body. Each {@link EventType} maps to exactly one payload record.
 */
public sealed interface EventPayload {

    EventType eventType();

    record UserJoined(Participant user) implements EventPayload {
        public UserJoined {
            Objects.requireNonNull(user, "user");
        }

        @Override
        public EventType eventType() { return EventType.USER_JOINED; }
    }

    record UserLeft(String userId) implements EventPayload {
        public UserLeft {
            Objects.requireNonNull(userId, "userId");
        }

        @Override
        public EventType eventType() { return EventType.USER_LEFT; }
    }

    record MessageSent(String messageId, String content) implements EventPayload {
        @Override
        public EventType eventType() { return EventType.MESSAGE_SENT; }
    }

    record MessageEdited(String messageId, String content) implements EventPayload {
        @Override
        public EventType eventType() { return EventType.MESSAGE_EDITED; }
    }

    record MessageDeleted(String messageId) implements EventPayload {
        @Override
        public EventType eventType() { return EventType.MESSAGE_DELETED; }
    }

    record CursorMove(Cursor cursor) implements EventPayload {
        @Override
        public EventType eventType() { return EventType.CURSOR_MOVE; }
    }

    record TypingStart() implements EventPayload {
        @Override
        public EventType eventType() { return EventType.TYPING_START; }
    }

    record TypingStop() implements EventPayload {
        @Override
        public EventType eventType() { return EventType.TYPING_STOP; }
    }

    record SessionSync(SyncAction action, Session session) implements EventPayload {
        public SessionSync {
            Objects.requireNonNull(action, "action");
        }

        @Override
        public EventType eventType() { return EventType.SESSION_SYNC; }
    }

    record ConflictDetected(String conflictId) implements EventPayload {
        @Override
        public EventType eventType() { return EventType.CONFLICT_DETECTED; }
    }

    enum SyncAction {
        CREATE,
        UPDATE,
        DELETE
    }
}
