package com.questrail.bhumi.relay.model;

/**
 * Liveness frame; empty payload, valid in either direction.
 */
public record Keepalive() implements RelayMessage
{
    public static final Keepalive INSTANCE = new Keepalive();

    @Override
    public RelayMessageType type() {
        return RelayMessageType.KEEPALIVE;
    }
}
