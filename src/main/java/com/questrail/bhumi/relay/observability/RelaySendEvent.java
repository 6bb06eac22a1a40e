package com.questrail.bhumi.relay.observability;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.SendStatus;

import java.time.Instant;

/**
 * Terminal resolution of one SEND.
 *
 * @param correlationId relay-assigned id, or {@code -1} when the send resolved
 *                      before anything was forwarded (cache hit, offline,
 *                      invalid capability)
 */
public record RelaySendEvent(
    Instant timestamp,
    Id52 recipient,
    SendStatus status,
    boolean fromCache,
    long correlationId
) {
}
