package com.questrail.bhumi.relay.api;

/**
 * Preimage
 * =============================================================================
 * A 256-bit secret whose hash is registered with the relay as a {@link Commit}.
 *
 * <p>Presenting a preimage authorizes exactly one send to the identity that
 * installed the matching commit. Preimages also key the global response cache,
 * which is safe because they are unguessable and single-use.</p>
 */
public final class Preimage extends FixedBytes {
    public static final int LENGTH = 32;

    private Preimage(byte[] value) {
        super(value, LENGTH, "preimage");
    }

    public static Preimage of(byte[] value) {
        return new Preimage(value);
    }

    // never print the secret itself
    @Override
    public String toString() {
        return "Preimage[" + Integer.toHexString(hashCode()) + "]";
    }
}
