package io.github.drompincen.collabsync.runtime.notify;

import java.util.Objects;

public record NotificationAction(String label, Runnable action) {

    public NotificationAction {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(action, "action");
    }

    public void perform() {
        action.run();
    }
}
