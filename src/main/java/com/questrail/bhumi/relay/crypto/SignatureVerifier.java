package com.questrail.bhumi.relay.crypto;

import com.questrail.bhumi.relay.api.Id52;

/**
 * SignatureVerifier
 * =============================================================================
 * Port for checking that {@code signature} was made over {@code message} by the
 * private key behind {@code signer}.
 *
 * <p>Implementations must return {@code false} (never throw) for keys or
 * signatures that are malformed, so callers have a single failure path.</p>
 */
@FunctionalInterface
public interface SignatureVerifier {
    boolean verify(Id52 signer, byte[] message, byte[] signature);
}
