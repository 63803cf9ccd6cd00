package io.github.drompincen.collabsync.protocol.api;

public enum ResolutionStrategy {
    MERGE,
    OVERWRITE,
    MANUAL
}
