package com.questrail.bhumi.relay.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * The production scheduler on real time: send deadlines and the periodic
 * sweeps the runtime arms on it. Waits are generous; only ordering and
 * "eventually / never" are asserted.
 */
class ScheduledExecutorSchedulerTest {

    private final MonotonicClock clock = SystemMonotonicClock.INSTANCE;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
    private final ScheduledExecutorScheduler scheduler = new ScheduledExecutorScheduler(executor, clock);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void sendDeadlineFiresAfterDelay() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        long armedAt = clock.nowNanos();
        long[] firedAt = new long[1];

        scheduler.scheduleAfter(Duration.ofMillis(40), clock, () -> {
            firedAt[0] = clock.nowNanos();
            fired.countDown();
        });

        assertTrue(fired.await(2, TimeUnit.SECONDS));
        assertTrue(firedAt[0] - armedAt >= TimeUnit.MILLISECONDS.toNanos(40));
    }

    @Test
    void overdueDeadlineRunsRightAway() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        scheduler.scheduleAtNanos(clock.nowNanos() - TimeUnit.SECONDS.toNanos(3), fired::countDown);

        assertTrue(fired.await(1, TimeUnit.SECONDS));
    }

    @Test
    void disarmedDeadlineNeverFires() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        Cancellable deadline = scheduler.scheduleAfter(Duration.ofMillis(60), clock, runs::incrementAndGet);

        assertTrue(deadline.cancel());
        Thread.sleep(150);

        assertEquals(0, runs.get());
        assertFalse(deadline.cancel());
    }

    @Test
    void disarmingAfterFiringReportsFalse() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        Cancellable deadline = scheduler.scheduleAtNanos(clock.nowNanos(), fired::countDown);

        assertTrue(fired.await(1, TimeUnit.SECONDS));
        Thread.sleep(20);

        assertFalse(deadline.cancel());
    }

    @Test
    void periodicTaskRearmsAndSurvivesFailingRuns() throws InterruptedException {
        CountDownLatch threeRuns = new CountDownLatch(3);
        List<RuntimeException> failures = new ArrayList<>();
        AtomicInteger runs = new AtomicInteger();

        PeriodicTask sweep = PeriodicTask.start(scheduler, clock, Duration.ofMillis(10), () -> {
            threeRuns.countDown();
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("first sweep fails");
            }
        }, e -> {
            synchronized (failures) {
                failures.add(e);
            }
        });

        assertTrue(threeRuns.await(2, TimeUnit.SECONDS));
        assertTrue(sweep.cancel());

        int afterCancel = runs.get();
        Thread.sleep(100);
        // at most one run already in progress at cancel time
        assertTrue(runs.get() <= afterCancel + 1);
        synchronized (failures) {
            assertEquals(1, failures.size());
        }
    }
}
