package com.questrail.bhumi.relay.testing;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.Preimage;
import com.questrail.bhumi.relay.crypto.Sha256CommitHasher;

import java.security.SecureRandom;

/**
 * Fresh preimages and their commits.
 */
public final class Preimages {
    private static final SecureRandom RANDOM = new SecureRandom();

    private Preimages() {}

    public static Preimage random() {
        byte[] b = new byte[Preimage.LENGTH];
        RANDOM.nextBytes(b);
        return Preimage.of(b);
    }

    public static Commit commitOf(Preimage p) {
        return Sha256CommitHasher.INSTANCE.commitOf(p);
    }
}
