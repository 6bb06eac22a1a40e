package com.questrail.bhumi.relay.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
