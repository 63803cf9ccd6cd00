package io.github.drompincen.collabsync.protocol.error;

/**
 * Root of the synchronization error taxonomy. Conflicts are not errors; they are recorded as
 * {@link io.github.drompincen.collabsync.protocol.api.ConflictRecord}s.
 */
public abstract class SyncException extends RuntimeException {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
