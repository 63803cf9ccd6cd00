package io.github.drompincen.collabsync.runtime.scheduler;

import java.time.Duration;

/**
 * Timer source for heartbeats, reconnect backoff, presence debounce and notification expiry.
 * Every timer hands back a {@link ScheduledTask} so its owner can cancel it deterministically.
 */
public interface SyncScheduler {

    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration period);
}
