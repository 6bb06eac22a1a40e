package com.questrail.bhumi.relay.crypto;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.Preimage;
import org.bouncycastle.crypto.digests.SHA256Digest;

import java.util.Objects;

/**
 * {@link CommitHasher} computing {@code SHA-256(preimage)}.
 */
public final class Sha256CommitHasher implements CommitHasher {
    public static final Sha256CommitHasher INSTANCE = new Sha256CommitHasher();

    private Sha256CommitHasher() {}

    @Override
    public Commit commitOf(Preimage preimage) {
        Objects.requireNonNull(preimage, "preimage");
        byte[] input = preimage.bytes();

        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Commit.of(out);
    }
}
