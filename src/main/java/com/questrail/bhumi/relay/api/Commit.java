package com.questrail.bhumi.relay.api;

/**
 * Commit
 * =============================================================================
 * One-way hash of a {@link Preimage}, installed by an identity as an admission
 * token for a single inbound send.
 */
public final class Commit extends FixedBytes {
    public static final int LENGTH = 32;

    private Commit(byte[] value) {
        super(value, LENGTH, "commit");
    }

    public static Commit of(byte[] value) {
        return new Commit(value);
    }

    @Override
    public String toString() {
        return "Commit[" + hex().substring(0, 8) + "]";
    }
}
