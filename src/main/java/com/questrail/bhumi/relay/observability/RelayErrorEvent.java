package com.questrail.bhumi.relay.observability;

import com.questrail.bhumi.relay.internal.state.ConnectionHandle;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the relay.
 *
 * @param handle connection concerned, or {@code null} for node-wide errors
 * @param fatal  whether the connection was closed because of it
 */
public record RelayErrorEvent(
    Instant timestamp,
    ConnectionHandle handle,
    String message,
    Throwable cause,
    boolean fatal
) {
}
