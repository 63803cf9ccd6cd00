package io.github.drompincen.collabsync.protocol.error;

/**
 * An operation referenced an unknown session, user or conflict, or ran in a state that does not allow it.
 */
public class StateException extends SyncException {

    public StateException(String message) {
        super(message);
    }
}
