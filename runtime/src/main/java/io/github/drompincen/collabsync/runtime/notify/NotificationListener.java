package io.github.drompincen.collabsync.runtime.notify;

@FunctionalInterface
public interface NotificationListener {

    void onNotification(Notification notification);
}
