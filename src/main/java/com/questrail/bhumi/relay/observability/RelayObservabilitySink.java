package com.questrail.bhumi.relay.observability;

/**
 * Main interface for receiving relay observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from Netty event loops and from the scheduler thread
 * concurrently; implementations must be thread-safe.</p>
 */
public interface RelayObservabilitySink {
    /**
     * Called when a connection opens, binds an identity, is displaced, evicted or closed.
     */
    void onConnectionEvent(RelayConnectionEvent event);

    /**
     * Called exactly once per SEND when its outcome is known.
     */
    void onSendResolved(RelaySendEvent event);

    /**
     * Called when a presence record is accepted or rejected, and after every gossip round.
     */
    void onPresenceEvent(RelayPresenceEvent event);

    /**
     * Called when an error or anomaly occurs.
     */
    void onError(RelayErrorEvent event);
}
