package com.questrail.bhumi.relay.time;

import com.questrail.bhumi.relay.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall clock for tests; moves only when told to.
 */
public final class ManualWallClock implements WallClock {

    private volatile Instant now;

    public ManualWallClock(Instant start) {
        this.now = start;
    }

    @Override
    public Instant now() {
        return now;
    }

    public void advance(Duration d) {
        now = now.plus(d);
    }
}
