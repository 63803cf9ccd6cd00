package io.github.drompincen.collabsync.protocol.api;

public record Cursor(
        double x,
        double y,
        String elementId
) {
    public static Cursor origin() {
        return new Cursor(0, 0, null);
    }
}
