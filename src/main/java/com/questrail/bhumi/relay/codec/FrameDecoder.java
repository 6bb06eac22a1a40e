package com.questrail.bhumi.relay.codec;

import com.questrail.bhumi.relay.internal.frame.RelayFrame;

import java.util.List;

/**
 * FrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for the relay's length-prefixed framing.
 *
 * <p>Unlike a datagram decoder, this decoder sits on a byte <em>stream</em>:
 * bytes arrive in arbitrary chunks and a frame may straddle any number of
 * chunks. Each instance therefore belongs to exactly one connection and keeps
 * the current partial frame between calls.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Splitting the stream into {@link RelayFrame}s in arrival order</li>
 *   <li>Rejecting implausible declared lengths before buffering them</li>
 *   <li>Bounding the amount of buffered, incomplete data</li>
 * </ul>
 *
 * <p>It is <strong>not</strong> responsible for interpreting frame types or
 * payloads.</p>
 */
public interface FrameDecoder
{
    /**
     * Feed the next chunk of the stream and collect every frame it completes.
     *
     * <p>Frames completed by this chunk are returned in stream order; an empty
     * list means more bytes are needed. Once this method has thrown, the decoder
     * is unusable and every further call throws again.</p>
     *
     * @param chunk bytes read from the transport, possibly empty
     * @return frames completed by this chunk
     * @throws FramingException if the stream is malformed
     */
    List<RelayFrame> feed(byte[] chunk) throws FramingException;

    /**
     * Number of bytes currently held for an incomplete frame.
     */
    int bufferedBytes();
}
