package io.github.drompincen.collabsync.runtime.scheduler;

public interface ScheduledTask {

    void cancel();

    boolean isCancelled();
}
