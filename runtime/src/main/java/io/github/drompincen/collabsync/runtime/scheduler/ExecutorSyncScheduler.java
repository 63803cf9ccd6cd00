package io.github.drompincen.collabsync.runtime.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public class ExecutorSyncScheduler implements SyncScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorSyncScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorSyncScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-scheduler");
            t.setDaemon(true);
            return t;
        }));
    }

    public ExecutorSyncScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(safely(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        long millis = period.toMillis();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(safely(task), millis, millis, TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // An exception escaping a periodic task would silently suppress all later runs.
    private static Runnable safely(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.warn("Scheduled task failed: {}", e.getMessage(), e);
            }
        };
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
