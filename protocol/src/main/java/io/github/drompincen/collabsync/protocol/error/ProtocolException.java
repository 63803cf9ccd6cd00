package io.github.drompincen.collabsync.protocol.error;

/**
 * Malformed frame or unknown message/event tag. Logged and dropped at the dispatch boundary.
 */
public class ProtocolException extends SyncException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
