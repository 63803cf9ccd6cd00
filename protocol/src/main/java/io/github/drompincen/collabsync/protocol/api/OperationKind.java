package io.github.drompincen.collabsync.protocol.api;

public enum OperationKind {
    INSERT,
    DELETE,
    RETAIN,
    FORMAT
}
