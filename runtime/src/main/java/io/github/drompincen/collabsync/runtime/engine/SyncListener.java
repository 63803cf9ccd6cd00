package io.github.drompincen.collabsync.runtime.engine;

import io.github.drompincen.collabsync.protocol.api.ConflictRecord;
import io.github.drompincen.collabsync.runtime.connection.ConnectionState;
import io.github.drompincen.collabsync.runtime.notify.Notification;

/**
 * Callbacks for the presentation layer. They run under the engine's monitor and should return quickly.
 */
public interface SyncListener {

    default void onConnectionStateChanged(ConnectionState previous, ConnectionState current) {
    }

    default void onConflict(ConflictRecord conflict) {
    }

    default void onNotification(Notification notification) {
    }
}
