package com.questrail.bhumi.relay.api;

/**
 * Id52
 * =============================================================================
 * A device identity: the 32-byte Ed25519 public key of the device.
 *
 * <p>This is the only addressing unit the relay knows about. The relay keeps no
 * account object per identity; everything keyed by an {@code Id52} is soft state
 * that disappears when the device's connection goes away.</p>
 */
public final class Id52 extends FixedBytes {
    public static final int LENGTH = 32;

    private Id52(byte[] value) {
        super(value, LENGTH, "id52");
    }

    public static Id52 of(byte[] value) {
        return new Id52(value);
    }

    /**
     * Short form used in log lines: the first eight hex characters.
     */
    public String shortHex() {
        return hex().substring(0, 8);
    }

    @Override
    public String toString() {
        return "Id52[" + shortHex() + "]";
    }
}
