package io.github.drompincen.collabsync.runtime.conflict;

import io.github.drompincen.collabsync.protocol.api.ConflictRecord;

@FunctionalInterface
public interface ConflictListener {

    void onConflict(ConflictRecord conflict);
}
