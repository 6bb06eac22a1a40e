package com.questrail.bhumi.relay.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every relay deadline: send timeouts, response-cache expiry,
 * idle-connection detection.
 *
 * <h2>Binding invariant</h2>
 * Operational timing MUST use a monotonic source. Wall-clock time is permitted
 * only for observability and for presence records, whose TTL is anchored on a
 * wall-clock issue time chosen by the issuer.
 */
public interface MonotonicClock {
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
