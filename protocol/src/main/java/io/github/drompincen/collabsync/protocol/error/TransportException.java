package io.github.drompincen.collabsync.protocol.error;

/**
 * Connect or send failure. Absorbed by the connection manager and turned into the reconnect policy.
 */
public class TransportException extends SyncException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
