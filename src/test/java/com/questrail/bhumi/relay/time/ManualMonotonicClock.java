package com.questrail.bhumi.relay.time;

import com.questrail.bhumi.relay.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock for tests. Starts at 0 and moves only through {@link #advance(Duration)}.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong(0);

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    public void advance(Duration d) {
        if (d.isNegative()) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        nowNanos.addAndGet(d.toNanos());
    }
}
