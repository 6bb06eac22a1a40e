package com.questrail.bhumi.relay.api;

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;
import java.util.Objects;

/**
 * FixedBytes
 * -----------------------------------------------------------------------------
 * Base type for the fixed-length, value-semantic byte strings that address
 * relay state ({@link Id52}, {@link Preimage}, {@link Commit}).
 *
 * <p>Instances are immutable: the backing array is copied on the way in and on
 * the way out. Equality and hashing are content based so that instances may be
 * used directly as keys in concurrent maps.</p>
 */
public abstract class FixedBytes {
    private final byte[] value;
    private final int hash;

    protected FixedBytes(byte[] value, int expectedLength, String kind) {
        Objects.requireNonNull(value, kind);
        if (value.length != expectedLength) {
            throw new IllegalArgumentException(
                    kind + " must be " + expectedLength + " bytes, got " + value.length);
        }
        this.value = value.clone();
        this.hash = Arrays.hashCode(this.value);
    }

    /**
     * Returns a copy of the underlying bytes.
     */
    public final byte[] bytes() {
        return value.clone();
    }

    /**
     * Returns the lowercase hex encoding of the value.
     */
    public final String hex() {
        return Hex.toHexString(value);
    }

    /**
     * Writes the value into {@code target} at {@code offset} without copying
     * it first.
     */
    public final void copyInto(byte[] target, int offset) {
        System.arraycopy(value, 0, target, offset, value.length);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(value, ((FixedBytes) o).value);
    }

    @Override
    public final int hashCode() {
        return hash;
    }
}
