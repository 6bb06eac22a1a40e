package com.questrail.bhumi.relay.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled relay task (a send deadline, a cache
 * sweep, a gossip round).
 */
public interface Cancellable {
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
