package io.github.drompincen.collabsync.runtime.notify;

import io.github.drompincen.collabsync.runtime.scheduler.ScheduledTask;
import io.github.drompincen.collabsync.runtime.scheduler.SyncScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * User-visible notifications. Non-persistent ones dismiss themselves after {@code ttl}.
 */
public class NotificationCenter {

    private static final Logger log = LoggerFactory.getLogger(NotificationCenter.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(5);
    static final int MAX_RETAINED = 200;

    private final SyncScheduler scheduler;
    private final Clock clock;
    private final Duration ttl;
    private final Map<String, Notification> notifications = new LinkedHashMap<>();
    private final Map<String, ScheduledTask> expiries = new HashMap<>();
    private final List<NotificationListener> listeners = new CopyOnWriteArrayList<>();

    public NotificationCenter(SyncScheduler scheduler, Clock clock, Duration ttl) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.ttl = ttl != null ? ttl : DEFAULT_TTL;
    }

    public Notification add(NotificationType type, String title, String message) {
        return add(type, title, message, List.of());
    }

    public Notification add(NotificationType type, String title, String message, List<NotificationAction> actions) {
        Notification notification = new Notification(UUID.randomUUID().toString(), type, title, message,
                clock.instant(), false, actions);
        notifications.put(notification.id(), notification);
        pruneDismissed();
        log.debug("Notification {} [{}]: {}", type, title, message);

        if (!type.persistent()) {
            expiries.put(notification.id(), scheduler.schedule(() -> expire(notification.id()), ttl));
        }
        for (NotificationListener listener : listeners) {
            try {
                listener.onNotification(notification);
            } catch (RuntimeException e) {
                log.warn("Notification listener failed: {}", e.getMessage(), e);
            }
        }
        return notification;
    }

    public boolean dismiss(String id) {
        ScheduledTask expiry = expiries.remove(id);
        if (expiry != null) expiry.cancel();
        Notification existing = notifications.get(id);
        if (existing == null || existing.dismissed()) {
            return false;
        }
        notifications.put(id, existing.dismiss());
        return true;
    }

    public void clear() {
        expiries.values().forEach(ScheduledTask::cancel);
        expiries.clear();
        notifications.clear();
    }

    /** Notifications not yet dismissed, oldest first. */
    public List<Notification> active() {
        List<Notification> result = new ArrayList<>();
        for (Notification n : notifications.values()) {
            if (!n.dismissed()) result.add(n);
        }
        return List.copyOf(result);
    }

    public List<Notification> all() {
        return List.copyOf(notifications.values());
    }

    public void addListener(NotificationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(NotificationListener listener) {
        listeners.remove(listener);
    }

    private void pruneDismissed() {
        Iterator<Notification> it = notifications.values().iterator();
        while (notifications.size() > MAX_RETAINED && it.hasNext()) {
            if (it.next().dismissed()) it.remove();
        }
    }

    private void expire(String id) {
        expiries.remove(id);
        Notification existing = notifications.get(id);
        if (existing != null && !existing.dismissed()) {
            notifications.put(id, existing.dismiss());
            log.debug("Notification {} expired", id);
        }
    }
}
