package com.questrail.bhumi.relay.crypto;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.Preimage;

/**
 * One-way function mapping a {@link Preimage} to the {@link Commit} that admits it.
 */
@FunctionalInterface
public interface CommitHasher {
    Commit commitOf(Preimage preimage);
}
