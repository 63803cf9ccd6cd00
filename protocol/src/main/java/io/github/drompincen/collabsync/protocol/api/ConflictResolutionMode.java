package io.github.drompincen.collabsync.protocol.api;

public enum ConflictResolutionMode {
    MANUAL,
    AUTO,
    OWNER_WINS;

    public ResolutionStrategy defaultStrategy() {
        return switch (this) {
            case AUTO -> ResolutionStrategy.MERGE;
            case OWNER_WINS -> ResolutionStrategy.OVERWRITE;
            case MANUAL -> ResolutionStrategy.MANUAL;
        };
    }
}
