package com.questrail.bhumi.relay.model;

/**
 * Range checks for u32 correlation ids carried in DELIVER and ACK.
 */
public final class CorrelationIds
{
    public static final long MAX = 0xFFFF_FFFFL;

    private CorrelationIds() {}

    static void check(long correlationId) {
        if (correlationId < 0 || correlationId > MAX) {
            throw new IllegalArgumentException("correlationId must fit in u32: " + correlationId);
        }
    }
}
