package com.questrail.bhumi.relay.observability;

/**
 * No-op implementation of RelayObservabilitySink.
 */
public final class NullObservabilitySink implements RelayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(RelayConnectionEvent event) {}

    @Override
    public void onSendResolved(RelaySendEvent event) {}

    @Override
    public void onPresenceEvent(RelayPresenceEvent event) {}

    @Override
    public void onError(RelayErrorEvent event) {}
}
