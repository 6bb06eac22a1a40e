package com.questrail.bhumi.relay.codec;

import com.questrail.bhumi.relay.internal.frame.RelayFrame;

/**
 * FrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound counterpart of {@link FrameDecoder}: turns a {@link RelayFrame} into
 * the exact bytes written to the transport.
 */
public interface FrameEncoder
{
    /**
     * Encode a frame as {@code u16 type ‖ u32 length ‖ payload}.
     *
     * @throws IllegalArgumentException if the payload exceeds the maximum
     *         payload size this encoder was built for
     */
    byte[] encode(RelayFrame frame);
}
