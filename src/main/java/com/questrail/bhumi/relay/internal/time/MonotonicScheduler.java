package com.questrail.bhumi.relay.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Runs relay timers: per-send deadlines armed by the send orchestrator and
 * the periodic cache sweep, idle sweep and gossip round.
 *
 * <p>Deadlines are monotonic ticks or durations, never wall-clock instants.
 * Tests substitute a deterministic implementation driven by a manual clock.</p>
 */
public interface MonotonicScheduler {
    /**
     * Runs {@code task} once, no earlier than {@code deadlineNanos} on the
     * {@link MonotonicClock} the caller read it from.
     *
     * @return handle that cancels the task if it has not run yet
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Runs {@code task} once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
