package io.github.drompincen.collabsync.protocol.error;

public class PermissionException extends SyncException {

    private final String userId;

    public PermissionException(String userId, String message) {
        super(message);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
