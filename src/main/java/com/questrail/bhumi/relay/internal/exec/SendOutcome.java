package com.questrail.bhumi.relay.internal.exec;

import com.questrail.bhumi.relay.api.SendStatus;
import com.questrail.bhumi.relay.model.SendResult;

import java.util.Objects;

/**
 * Resolution of one SEND as produced by the {@link SendOrchestrator}.
 *
 * @param fromCache whether the payload came from the response cache rather
 *                  than a fresh acknowledgment
 */
public record SendOutcome(SendStatus status, byte[] payload, boolean fromCache) {
    private static final byte[] EMPTY = new byte[0];

    public SendOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(payload, "payload");
    }

    public static SendOutcome acknowledged(byte[] payload) {
        return new SendOutcome(SendStatus.OK, payload, false);
    }

    public static SendOutcome cached(byte[] payload) {
        return new SendOutcome(SendStatus.OK, payload, true);
    }

    public static SendOutcome failed(SendStatus status) {
        if (status == SendStatus.OK) {
            throw new IllegalArgumentException("failure status required");
        }
        return new SendOutcome(status, EMPTY, false);
    }

    public SendResult toResult() {
        return new SendResult(status, payload);
    }
}
