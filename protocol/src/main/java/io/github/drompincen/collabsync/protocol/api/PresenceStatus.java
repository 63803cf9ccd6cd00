package io.github.drompincen.collabsync.protocol.api;

public enum PresenceStatus {
    ONLINE,
    AWAY,
    OFFLINE
}
