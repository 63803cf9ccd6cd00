package io.github.drompincen.collabsync.protocol.api;

public enum Role {
    OWNER,
    EDITOR,
    VIEWER;

    public boolean canEdit() {
        return this == OWNER || this == EDITOR;
    }
}
