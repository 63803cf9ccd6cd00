package io.github.drompincen.collabsync.runtime.connection;

import io.github.drompincen.collabsync.protocol.ws.WsMessage;

public interface ConnectionListener {

    void onStateChanged(ConnectionState previous, ConnectionState current);

    void onMessage(WsMessage message);

    default void onTransportError(Throwable error) {
    }
}
