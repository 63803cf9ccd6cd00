package io.github.drompincen.collabsync.runtime.event;

public enum EventOutcome {
    APPLIED,
    /** Echo of a local tentative event. */
    RECONCILED,
    DUPLICATE,
    STALE,
    CONFLICTED
}
