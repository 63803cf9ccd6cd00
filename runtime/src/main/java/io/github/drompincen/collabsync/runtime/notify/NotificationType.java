package io.github.drompincen.collabsync.runtime.notify;

public enum NotificationType {
    USER_JOINED,
    USER_LEFT,
    CONFLICT,
    SYNC_ERROR,
    CONNECTION_STATUS;

    /** Persistent notifications stay until dismissed explicitly. */
    public boolean persistent() {
        return this == CONFLICT || this == SYNC_ERROR;
    }
}
