package io.github.drompincen.collabsync.protocol.api;

public record Viewport(double scrollTop, double scrollLeft) {

    public static Viewport top() {
        return new Viewport(0, 0);
    }
}
