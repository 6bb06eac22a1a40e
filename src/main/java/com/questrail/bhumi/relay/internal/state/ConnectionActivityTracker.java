package com.questrail.bhumi.relay.internal.state;

import com.questrail.bhumi.relay.internal.time.MonotonicClock;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ConnectionActivityTracker
 * -----------------------------------------------------------------------------
 * Tracks the last inbound activity of every connection in monotonic time.
 *
 * <p>The session records activity for every chunk of bytes it receives, so a
 * KEEPALIVE is enough to keep an otherwise silent device connected.</p>
 */
public final class ConnectionActivityTracker {

    private final MonotonicClock clock;
    private final Map<ConnectionHandle, Long> lastActivityNanos = new ConcurrentHashMap<>();

    public ConnectionActivityTracker(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts tracking a newly registered connection as active now.
     */
    public void track(ConnectionHandle handle) {
        lastActivityNanos.put(handle, clock.nowNanos());
    }

    /**
     * Refreshes a tracked connection. Once {@link #forget} has run for the
     * handle, late activity is ignored.
     */
    public void recordActivity(ConnectionHandle handle) {
        lastActivityNanos.computeIfPresent(handle, (h, last) -> clock.nowNanos());
    }

    /**
     * Returns the last activity time of the connection, or {@code Long.MIN_VALUE}
     * if it is not tracked.
     */
    public long lastActivityNanos(ConnectionHandle handle) {
        return lastActivityNanos.getOrDefault(handle, Long.MIN_VALUE);
    }

    public boolean isIdle(ConnectionHandle handle, long idleNanos) {
        Long last = lastActivityNanos.get(handle);
        return last != null && clock.nowNanos() - last >= idleNanos;
    }

    public int trackedCount() {
        return lastActivityNanos.size();
    }

    public void forget(ConnectionHandle handle) {
        lastActivityNanos.remove(handle);
    }
}
