package io.github.drompincen.collabsync.runtime.notify;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public record Notification(
        String id,
        NotificationType type,
        String title,
        String message,
        Instant timestamp,
        boolean dismissed,
        List<NotificationAction> actions
) {

    public Notification {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public Notification dismiss() {
        return new Notification(id, type, title, message, timestamp, true, actions);
    }

    public Optional<NotificationAction> action(String label) {
        return actions.stream().filter(a -> a.label().equals(label)).findFirst();
    }
}
