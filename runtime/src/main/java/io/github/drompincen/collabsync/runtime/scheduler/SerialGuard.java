package io.github.drompincen.collabsync.runtime.scheduler;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * The single monitor of one engine. Local API calls, transport callbacks and timer callbacks all run
 * through it, so each one completes before the next starts.
 */
public final class SerialGuard {

    public void run(Runnable action) {
        synchronized (this) {
            action.run();
        }
    }

    public <T> T call(Supplier<T> action) {
        synchronized (this) {
            return action.get();
        }
    }

    public Runnable wrap(Runnable action) {
        return () -> run(action);
    }

    public SyncScheduler guard(SyncScheduler delegate) {
        return new SyncScheduler() {
            @Override
            public ScheduledTask schedule(Runnable task, Duration delay) {
                return delegate.schedule(wrap(task), delay);
            }

            @Override
            public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
                return delegate.scheduleAtFixedRate(wrap(task), period);
            }
        };
    }
}
