package com.questrail.bhumi.relay.observability;

import com.questrail.bhumi.relay.api.Id52;

import java.time.Instant;

/**
 * Presence store and gossip activity.
 *
 * @param identity subject of the event, or {@code null} for a gossip round
 * @param count    records forwarded in a gossip round, otherwise {@code 0}
 */
public record RelayPresenceEvent(
    Instant timestamp,
    Kind kind,
    Id52 identity,
    int count
) {
    public enum Kind {
        ACCEPTED,
        REJECTED_SIGNATURE,
        REJECTED_EXPIRED,
        REJECTED_STALE,
        GOSSIP_ROUND
    }
}
