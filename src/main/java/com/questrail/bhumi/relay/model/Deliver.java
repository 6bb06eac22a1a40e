package com.questrail.bhumi.relay.model;

import java.util.Objects;

/**
 * Relay → recipient delivery of a SEND payload.
 *
 * @param correlationId relay-assigned id (u32) the recipient echoes in ACK
 */
public record Deliver(long correlationId, byte[] payload) implements RelayMessage
{
    public Deliver {
        CorrelationIds.check(correlationId);
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public RelayMessageType type() {
        return RelayMessageType.DELIVER;
    }
}
