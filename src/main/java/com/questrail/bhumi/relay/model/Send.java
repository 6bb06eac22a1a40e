package com.questrail.bhumi.relay.model;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.Preimage;

import java.util.Objects;

/**
 * Client → relay request to deliver {@code payload} to {@code to}.
 *
 * <p>Nothing here identifies the sender.</p>
 */
public record Send(Id52 to, Preimage preimage, byte[] payload) implements RelayMessage
{
    public Send {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(preimage, "preimage");
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public RelayMessageType type() {
        return RelayMessageType.SEND;
    }
}
