package com.questrail.bhumi.relay.internal.state;

import com.questrail.bhumi.relay.api.Id52;

/**
 * Raised when an identity claim does not carry a valid signature over the
 * connection's challenge. The claiming connection must be closed.
 */
public final class IdentityVerificationException extends RuntimeException {
    private final transient Id52 claimed;

    public IdentityVerificationException(Id52 claimed, String message) {
        super(message);
        this.claimed = claimed;
    }

    public Id52 claimed() {
        return claimed;
    }
}
