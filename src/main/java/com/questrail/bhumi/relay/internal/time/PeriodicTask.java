package com.questrail.bhumi.relay.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * PeriodicTask
 * =============================================================================
 * Fixed-delay repetition built on the one-shot {@link MonotonicScheduler}: each
 * run re-arms the next one after it finishes, so runs never overlap.
 *
 * <p>Used for the response-cache sweep, idle-connection sweep and gossip
 * rounds. A failing run is reported to {@code onFailure} and does not stop the
 * repetition.</p>
 */
public final class PeriodicTask implements Cancellable {
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final Runnable body;
    private final Consumer<RuntimeException> onFailure;

    private final Object lock = new Object();
    private Cancellable next;
    private boolean cancelled;

    private PeriodicTask(MonotonicScheduler scheduler,
                         MonotonicClock clock,
                         Duration interval,
                         Runnable body,
                         Consumer<RuntimeException> onFailure) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.body = Objects.requireNonNull(body, "body");
        this.onFailure = Objects.requireNonNull(onFailure, "onFailure");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /**
     * Starts repeating {@code body} every {@code interval}; the first run happens
     * one interval from now.
     */
    public static PeriodicTask start(MonotonicScheduler scheduler,
                                     MonotonicClock clock,
                                     Duration interval,
                                     Runnable body,
                                     Consumer<RuntimeException> onFailure) {
        PeriodicTask task = new PeriodicTask(scheduler, clock, interval, body, onFailure);
        task.arm();
        return task;
    }

    private void arm() {
        synchronized (lock) {
            if (!cancelled) {
                next = scheduler.scheduleAfter(interval, clock, this::runOnce);
            }
        }
    }

    private void runOnce() {
        synchronized (lock) {
            if (cancelled) {
                return;
            }
        }
        try {
            body.run();
        } catch (RuntimeException e) {
            onFailure.accept(e);
        }
        arm();
    }

    @Override
    public boolean cancel() {
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            if (next != null) {
                next.cancel();
            }
            return true;
        }
    }
}
