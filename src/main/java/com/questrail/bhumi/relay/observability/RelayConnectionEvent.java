package com.questrail.bhumi.relay.observability;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.internal.state.ConnectionHandle;

import java.time.Instant;

/**
 * Lifecycle change of a device connection.
 *
 * @param identity bound identity, or {@code null} if none was bound
 */
public record RelayConnectionEvent(
    Instant timestamp,
    ConnectionHandle handle,
    Kind kind,
    Id52 identity,
    String detail
) {
    public enum Kind {
        OPENED,
        BOUND,
        DISPLACED,
        IDLE_EVICTED,
        CLOSED
    }
}
