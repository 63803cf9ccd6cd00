package io.github.drompincen.collabsync.protocol.ws;

public enum WsMessageType {
    // Client -> Relay
    JOIN_SESSION,
    LEAVE_SESSION,
    SYNC_REQUEST,

    // Both directions
    EVENT,
    OPERATION,
    PRESENCE_UPDATE,
    HEARTBEAT,

    // Relay -> Client
    SYNC_RESPONSE,
    CONFLICT,
    ERROR
}
