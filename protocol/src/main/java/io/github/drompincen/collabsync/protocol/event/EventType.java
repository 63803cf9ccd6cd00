package io.github.drompincen.collabsync.protocol.event;

public enum EventType {
    USER_JOINED(EventPayload.UserJoined.class),
    USER_LEFT(EventPayload.UserLeft.class),
    MESSAGE_SENT(EventPayload.MessageSent.class),
    MESSAGE_EDITED(EventPayload.MessageEdited.class),
    MESSAGE_DELETED(EventPayload.MessageDeleted.class),
    CURSOR_MOVE(EventPayload.CursorMove.class),
    TYPING_START(EventPayload.TypingStart.class),
    TYPING_STOP(EventPayload.TypingStop.class),
    SESSION_SYNC(EventPayload.SessionSync.class),
    CONFLICT_DETECTED(EventPayload.ConflictDetected.class);

    private final Class<? extends EventPayload> payloadType;

    EventType(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }
}
