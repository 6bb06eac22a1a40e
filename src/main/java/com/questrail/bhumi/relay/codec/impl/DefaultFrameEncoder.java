package com.questrail.bhumi.relay.codec.impl;

import com.questrail.bhumi.relay.codec.FrameEncoder;
import com.questrail.bhumi.relay.internal.frame.RelayFrame;

import java.util.Objects;

/**
 * DefaultFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameEncoder}.
 *
 * <p>Symmetric with {@link DefaultFrameDecoder}: a frame produced by this
 * encoder is always accepted by a decoder configured with the same maximum.</p>
 */
public final class DefaultFrameEncoder implements FrameEncoder
{
    private final int maxPayload;

    public DefaultFrameEncoder() {
        this(RelayFraming.DEFAULT_MAX_PAYLOAD);
    }

    public DefaultFrameEncoder(int maxPayload) {
        this.maxPayload = RelayFraming.checkMaxPayload(maxPayload);
    }

    @Override
    public byte[] encode(RelayFrame frame) {
        Objects.requireNonNull(frame, "frame");

        byte[] payload = frame.payload();
        if (payload.length > maxPayload) {
            throw new IllegalArgumentException(
                    "payload of " + payload.length + " bytes exceeds maximum " + maxPayload);
        }

        byte[] out = new byte[RelayFraming.HEADER_LENGTH + payload.length];
        RelayFraming.writeHeader(out, frame.type(), payload.length);
        System.arraycopy(payload, 0, out, RelayFraming.HEADER_LENGTH, payload.length);
        return out;
    }
}
