package com.questrail.bhumi.relay.model;

import java.util.Objects;

/**
 * Recipient → relay acknowledgment of a DELIVER. The payload is the recipient's
 * encrypted response and is opaque to the relay.
 */
public record Ack(long correlationId, byte[] payload) implements RelayMessage
{
    public Ack {
        CorrelationIds.check(correlationId);
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public RelayMessageType type() {
        return RelayMessageType.ACK;
    }
}
