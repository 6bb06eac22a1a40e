package com.questrail.bhumi.relay.internal.frame;

import java.util.Objects;

/**
 * RelayFrame
 * -----------------------------------------------------------------------------
 * A single relay frame after length-prefix framing has been removed.
 *
 * <p>A frame is only a {@code (type, payload)} pair. It carries no semantics;
 * mapping a frame to a protocol message is the job of the message decoder.</p>
 *
 * <p>The payload array is owned by the frame once constructed. Callers must not
 * mutate arrays they pass in or obtain from {@link #payload()}.</p>
 */
public record RelayFrame(int type, byte[] payload)
{
    public RelayFrame {
        if (type < 0 || type > 0xFFFF) {
            throw new IllegalArgumentException("frame type must fit in u16: " + type);
        }
        Objects.requireNonNull(payload, "payload");
    }

    public static RelayFrame empty(int type) {
        return new RelayFrame(type, new byte[0]);
    }

    @Override
    public String toString() {
        return "RelayFrame[type=0x" + Integer.toHexString(type) + ", length=" + payload.length + "]";
    }
}
