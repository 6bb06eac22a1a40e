package com.questrail.bhumi.relay.model;

import com.questrail.bhumi.relay.api.PresenceRecord;

import java.util.Objects;

/**
 * Presence assertion as exchanged between clients and relays.
 */
public record Presence(PresenceRecord record) implements RelayMessage
{
    public Presence {
        Objects.requireNonNull(record, "record");
    }

    @Override
    public RelayMessageType type() {
        return RelayMessageType.PRESENCE;
    }
}
