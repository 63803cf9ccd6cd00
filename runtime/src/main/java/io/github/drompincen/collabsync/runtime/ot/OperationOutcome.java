package io.github.drompincen.collabsync.runtime.ot;

public enum OperationOutcome {
    /** Echo of a local operation; it moved from pending to confirmed. */
    ACKNOWLEDGED,
    APPLIED
}
