package io.github.drompincen.collabsync.runtime.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorSyncSchedulerTest {

    private ExecutorSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ExecutorSyncScheduler();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void scheduledTaskRuns() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.schedule(latch::countDown, Duration.ofMillis(10));

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void cancelledTaskReportsCancelled() {
        ScheduledTask task = scheduler.schedule(() -> { }, Duration.ofMinutes(1));

        task.cancel();

        assertThat(task.isCancelled()).isTrue();
    }

    @Test
    void periodicTaskSurvivesFailure() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(3);

        ScheduledTask task = scheduler.scheduleAtFixedRate(() -> {
            runs.incrementAndGet();
            latch.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ofMillis(5));

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        task.cancel();
        assertThat(runs.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void guardedSchedulerRunsTasksUnderGuard() throws InterruptedException {
        SerialGuard guard = new SerialGuard();
        CountDownLatch latch = new CountDownLatch(1);
        boolean[] held = new boolean[1];

        guard.guard(scheduler).schedule(() -> {
            held[0] = Thread.holdsLock(guard);
            latch.countDown();
        }, Duration.ofMillis(1));

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(held[0]).isTrue();
    }
}
