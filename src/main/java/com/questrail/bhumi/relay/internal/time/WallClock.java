package com.questrail.bhumi.relay.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for observability timestamps and presence-record expiry.
 *
 * <p>It may jump due to NTP adjustments. It MUST NOT drive send deadlines or
 * response-cache expiry.</p>
 */
@FunctionalInterface
public interface WallClock {
    Instant now();
}
