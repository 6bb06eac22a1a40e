package com.questrail.bhumi.relay.internal.state;

/**
 * Opaque, process-unique handle of a live transport connection.
 */
public record ConnectionHandle(long value) {
    @Override
    public String toString() {
        return "conn-" + value;
    }
}
