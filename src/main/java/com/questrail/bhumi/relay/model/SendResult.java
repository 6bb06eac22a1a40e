package com.questrail.bhumi.relay.model;

import com.questrail.bhumi.relay.api.SendStatus;

import java.util.Objects;

/**
 * Relay → sender terminal outcome of one SEND. The payload is empty unless
 * {@code status} is {@link SendStatus#OK}.
 */
public record SendResult(SendStatus status, byte[] payload) implements RelayMessage
{
    public SendResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(payload, "payload");
    }

    public static SendResult ok(byte[] payload) {
        return new SendResult(SendStatus.OK, payload);
    }

    public static SendResult failure(SendStatus status) {
        if (status == SendStatus.OK) {
            throw new IllegalArgumentException("failure status required");
        }
        return new SendResult(status, new byte[0]);
    }

    @Override
    public RelayMessageType type() {
        return RelayMessageType.SEND_RESULT;
    }
}
